package com.projecthub.xp.bot;

import com.projecthub.xp.event.XpEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every heuristic against an event. Heuristics fire independently, so one event may raise several alerts.
 */
@Component
public class BotDetector {

    public static final int FLAG_THRESHOLD = 50;

    private final List<BotHeuristic> heuristics;

    public BotDetector() {
        this(List.of(new RapidProjectPublishingHeuristic(), new RapidIdeaSubmissionHeuristic()));
    }

    BotDetector(List<BotHeuristic> heuristics) {
        this.heuristics = List.copyOf(heuristics);
    }

    public List<BotAlertDraft> inspect(XpEvent event, ActorHistory history) {
        List<BotAlertDraft> alerts = new ArrayList<>();
        for (BotHeuristic heuristic : heuristics) {
            Optional<BotAlertDraft> alert = heuristic.inspect(event, history);
            alert.ifPresent(alerts::add);
        }
        return alerts;
    }

    /**
     * @return the score after adding {@code increase}; the score has no upper bound and never decreases
     */
    public static int accumulateScore(int currentScore, int increase) {
        return Math.max(0, currentScore) + Math.max(0, increase);
    }

    public static boolean crossesFlagThreshold(int botScore) {
        return botScore >= FLAG_THRESHOLD;
    }
}
