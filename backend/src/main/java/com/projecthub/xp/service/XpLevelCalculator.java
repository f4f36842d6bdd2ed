package com.projecthub.xp.service;

/**
 * {@code level = floor(sqrt(totalXp / 100)) + 1}, never below 1.
 */
public final class XpLevelCalculator {

    private XpLevelCalculator() {
    }

    public static int levelFor(int totalXp) {
        if (totalXp <= 0) {
            return 1;
        }
        int hundreds = totalXp / 100;
        int root = (int) Math.sqrt(hundreds);
        // Guard the double sqrt against off-by-one at perfect squares.
        while ((long) root * root > hundreds) {
            root--;
        }
        while ((long) (root + 1) * (root + 1) <= hundreds) {
            root++;
        }
        return Math.max(1, root + 1);
    }
}
