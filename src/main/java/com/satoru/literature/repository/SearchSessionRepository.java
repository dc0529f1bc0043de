package com.satoru.literature.repository;

import com.satoru.literature.model.SearchSession;
import com.satoru.literature.model.SessionSummary;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SearchSessionRepository {
    SearchSession save(SearchSession session);
    List<SessionSummary> findByOwner(String owner, int limit);
    Optional<SearchSession> findByIdAndOwner(UUID id, String owner);
    int deleteByIdAndOwner(UUID id, String owner);
    int deleteAllByOwner(String owner);
}
