package io.github.drompincen.simgate.gateway.controller;

import io.github.drompincen.simgate.protocol.api.SessionSummaryDto;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping
    public List<SessionSummaryDto> list() {
        return sessionManager.list();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> close(@PathVariable String id) {
        return sessionManager.close(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
