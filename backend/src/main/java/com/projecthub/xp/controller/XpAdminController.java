package com.projecthub.xp.controller;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.service.LeaderboardRankingService;
import com.projecthub.xp.service.XpAggregateRepairService;
import com.projecthub.xp.service.XpBackfillService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/xp/admin")
public class XpAdminController {

    private final LeaderboardRankingService leaderboardRankingService;
    private final XpAggregateRepairService xpAggregateRepairService;
    private final XpBackfillService xpBackfillService;

    public XpAdminController(
            LeaderboardRankingService leaderboardRankingService,
            XpAggregateRepairService xpAggregateRepairService,
            XpBackfillService xpBackfillService
    ) {
        this.leaderboardRankingService = leaderboardRankingService;
        this.xpAggregateRepairService = xpAggregateRepairService;
        this.xpBackfillService = xpBackfillService;
    }

    @PostMapping("/leaderboard/recompute")
    public ResponseEntity<XpEventResponses.RecomputeResult> recomputeLeaderboard() {
        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();
        XpEventResponses.RecomputeResult body = new XpEventResponses.RecomputeResult(
                outcome.completed(),
                outcome.rankedActors(),
                outcome.computedAt()
        );
        if (!outcome.completed()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/repair")
    public ResponseEntity<XpEventResponses.RepairResult> repairAggregates() {
        return ResponseEntity.ok(new XpEventResponses.RepairResult(xpAggregateRepairService.repairAll()));
    }

    @PostMapping("/backfill")
    public ResponseEntity<XpEventResponses.BackfillResult> backfill(
            @Valid @RequestBody XpEventRequests.BackfillRequest request
    ) {
        return ResponseEntity.ok(xpBackfillService.backfill(request));
    }
}
