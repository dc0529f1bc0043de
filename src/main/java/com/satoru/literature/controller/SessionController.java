package com.satoru.literature.controller;

import com.satoru.literature.model.FetchResult;
import com.satoru.literature.model.SearchSession;
import com.satoru.literature.model.SessionPage;
import com.satoru.literature.model.SessionSummary;
import com.satoru.literature.service.SearchSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SearchSessionService sessionService;

    @PostMapping
    public ResponseEntity<SaveSessionResponse> saveSession(
        Principal principal,
        @Valid @RequestBody SaveSessionRequest request) {

        FetchResult result = new FetchResult(request.totalCount(), request.articles(), request.tokens());
        UUID id = sessionService.save(principal.getName(), request.query(), result);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SaveSessionResponse(id));
    }

    @GetMapping
    public ResponseEntity<List<SessionSummary>> listSessions(
        Principal principal,
        @RequestParam(name = "limit", defaultValue = "20") int limit) {

        return ResponseEntity.ok(sessionService.list(principal.getName(), limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SearchSession> getSession(Principal principal, @PathVariable UUID id) {
        return ResponseEntity.ok(sessionService.get(principal.getName(), id));
    }

    @GetMapping("/{id}/reload")
    public ResponseEntity<SessionPage> reloadSession(
        Principal principal,
        @PathVariable UUID id,
        @RequestParam(name = "page_size", defaultValue = "10") int pageSize,
        @RequestParam(name = "offset", defaultValue = "0") int offset) {

        QueryChecks.paging(pageSize, offset);
        return ResponseEntity.ok(sessionService.reload(principal.getName(), id, pageSize, offset));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSession(Principal principal, @PathVariable UUID id) {
        sessionService.delete(principal.getName(), id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<ClearSessionsResponse> clearSessions(Principal principal) {
        return ResponseEntity.ok(new ClearSessionsResponse(sessionService.clear(principal.getName())));
    }
}
