package com.projecthub.xp.rules;

/**
 * Ledger view of one reviewer's bonus for one review.
 *
 * @param grants    number of bonus grants ever applied (the latest generation number)
 * @param netAmount sum of grants and revocations, either 0 or the bonus amount
 */
public record PublicReviewBonusState(int grants, int netAmount) {

    public static final PublicReviewBonusState NONE = new PublicReviewBonusState(0, 0);

    public boolean currentlyGranted() {
        return netAmount > 0;
    }
}
