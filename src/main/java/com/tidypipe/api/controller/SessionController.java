package com.tidypipe.api.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import com.tidypipe.api.entity.request.RunRequest;
import com.tidypipe.api.entity.response.RunResponse;
import com.tidypipe.api.entity.response.SessionCreateResponse;
import com.tidypipe.api.exception.SessionNotFoundException;
import com.tidypipe.api.service.PipelineService;
import com.tidypipe.api.session.SessionManager;

import javax.validation.Valid;

@RestController
@RequestMapping("/api/sessions")
@Validated
public class SessionController {

    private final SessionManager sessionManager;
    private final PipelineService pipelineService;

    public SessionController(SessionManager sessionManager, PipelineService pipelineService) {
        this.sessionManager = sessionManager;
        this.pipelineService = pipelineService;
    }

    @PostMapping
    public ResponseEntity<SessionCreateResponse> createSession() {
        String sessionId = sessionManager.createSession();
        return ResponseEntity.ok(new SessionCreateResponse(sessionId, System.currentTimeMillis()));
    }

    @PostMapping("/{sessionId}/run")
    public ResponseEntity<RunResponse<?>> run(@PathVariable String sessionId,
                                              @Valid @RequestBody RunRequest request) {
        return ResponseEntity.ok(pipelineService.runWithSession(sessionId, request.getProgram(), request.getFormat()));
    }

    @PostMapping("/{sessionId}/reset")
    public ResponseEntity<Void> reset(@PathVariable String sessionId) {
        pipelineService.reset(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/names")
    public ResponseEntity<RunResponse<List<String>>> names(@PathVariable String sessionId) {
        return ResponseEntity.ok(RunResponse.success(pipelineService.names(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        boolean removed = sessionManager.closeSession(sessionId);
        if (removed) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<RunResponse<?>> sessionNotFound(SessionNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(RunResponse.failure(ex.getMessage()));
    }
}
