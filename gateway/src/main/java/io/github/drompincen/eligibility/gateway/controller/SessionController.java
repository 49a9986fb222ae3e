package io.github.drompincen.eligibility.gateway.controller;

import io.github.drompincen.eligibility.runtime.agent.TurnService;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final TurnService turnService;

    public SessionController(TurnService turnService) {
        this.turnService = turnService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return turnService.currentState(id)
                .map(ConversationState::toDto)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> reset(@PathVariable String id) {
        turnService.reset(id);
        return ResponseEntity.noContent().build();
    }
}
