package com.projecthub.xp.controller;

import com.projecthub.xp.dto.ActorRequests;
import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.service.ActorService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/xp/actors")
public class ActorController {

    private final ActorService actorService;

    public ActorController(ActorService actorService) {
        this.actorService = actorService;
    }

    @PostMapping
    public ResponseEntity<ActorResponses.ActorStanding> provisionActor(
            @Valid @RequestBody ActorRequests.ProvisionActorRequest request
    ) {
        return ResponseEntity.ok(actorService.provision(request));
    }

    @GetMapping("/{actorId}")
    public ResponseEntity<ActorResponses.ActorStanding> getStanding(@PathVariable UUID actorId) {
        return ResponseEntity.ok(actorService.getStanding(actorId));
    }

    @GetMapping("/{actorId}/transactions")
    public ResponseEntity<List<ActorResponses.XpTransactionEntry>> getHistory(
            @PathVariable UUID actorId,
            @RequestParam(defaultValue = "50") int limit
    ) {
        return ResponseEntity.ok(actorService.getHistory(actorId, limit));
    }
}
