package io.github.drompincen.eligibility.gateway.controller;

import io.github.drompincen.eligibility.protocol.api.TurnRequest;
import io.github.drompincen.eligibility.protocol.api.TurnResponse;
import io.github.drompincen.eligibility.runtime.agent.TurnService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/turns")
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final TurnService turnService;

    public TurnController(TurnService turnService) {
        this.turnService = turnService;
    }

    @PostMapping
    public ResponseEntity<?> submit(@RequestBody(required = false) TurnRequest request) {
        if (request == null || request.sessionId() == null || request.sessionId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "sessionId is required"));
        }
        TurnResponse response = turnService.handle(request);
        log.debug("Session {} -> {} ({})", request.sessionId(), response.decision(), response.usedModel());
        return ResponseEntity.ok(response);
    }
}
