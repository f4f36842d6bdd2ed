package com.projecthub.xp.controller;

import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.dto.BotAlertRequests;
import com.projecthub.xp.dto.BotAlertResponses;
import com.projecthub.xp.service.BotAlertReviewService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/xp")
public class BotAlertController {

    private final BotAlertReviewService botAlertReviewService;

    public BotAlertController(BotAlertReviewService botAlertReviewService) {
        this.botAlertReviewService = botAlertReviewService;
    }

    @GetMapping("/admin/bot-alerts")
    public ResponseEntity<List<BotAlertResponses.BotAlertDetail>> listUnreviewedAlerts() {
        return ResponseEntity.ok(botAlertReviewService.listUnreviewed());
    }

    @PostMapping("/admin/bot-alerts/{alertId}/review")
    public ResponseEntity<BotAlertResponses.BotAlertDetail> markReviewed(
            @PathVariable UUID alertId,
            @Valid @RequestBody BotAlertRequests.ReviewAlertRequest request
    ) {
        return ResponseEntity.ok(botAlertReviewService.markReviewed(alertId, request));
    }

    @PostMapping("/bot-alerts/{alertId}/dispute")
    public ResponseEntity<BotAlertResponses.BotAlertDetail> dispute(
            @PathVariable UUID alertId,
            @Valid @RequestBody BotAlertRequests.DisputeAlertRequest request
    ) {
        return ResponseEntity.ok(botAlertReviewService.dispute(alertId, request));
    }

    @PostMapping("/admin/actors/{actorId}/clear-bot-flag")
    public ResponseEntity<ActorResponses.ActorStanding> clearBotFlag(@PathVariable UUID actorId) {
        return ResponseEntity.ok(botAlertReviewService.clearBotFlag(actorId));
    }
}
