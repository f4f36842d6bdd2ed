package com.projecthub.xp.controller;

import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.service.ActorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/xp/leaderboard")
public class LeaderboardController {

    private final ActorService actorService;

    public LeaderboardController(ActorService actorService) {
        this.actorService = actorService;
    }

    @GetMapping
    public ResponseEntity<List<ActorResponses.LeaderboardEntry>> getLeaderboard(
            @RequestParam(defaultValue = "100") int limit
    ) {
        return ResponseEntity.ok(actorService.getLeaderboard(limit));
    }
}
