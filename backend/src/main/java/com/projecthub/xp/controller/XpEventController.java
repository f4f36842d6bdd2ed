package com.projecthub.xp.controller;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.service.XpEventService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/xp/events")
public class XpEventController {

    private final XpEventService xpEventService;

    public XpEventController(XpEventService xpEventService) {
        this.xpEventService = xpEventService;
    }

    @PostMapping
    public ResponseEntity<XpEventResponses.RecordEventResult> recordEvent(
            @Valid @RequestBody XpEventRequests.RecordEventRequest request
    ) {
        return ResponseEntity.ok(xpEventService.recordEvent(request));
    }
}
