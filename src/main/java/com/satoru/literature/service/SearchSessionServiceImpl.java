package com.satoru.literature.service;

import com.satoru.literature.config.SessionProperties;
import com.satoru.literature.exception.SessionNotFoundException;
import com.satoru.literature.exception.StructuralException;
import com.satoru.literature.exception.TransportException;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.FetchResult;
import com.satoru.literature.model.SearchSession;
import com.satoru.literature.model.SessionPage;
import com.satoru.literature.model.SessionSummary;
import com.satoru.literature.repository.SearchSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchSessionServiceImpl implements SearchSessionService {

    static final String RESUBMIT_SORT = "relevance";

    private final SearchSessionRepository sessionRepository;
    private final LiteratureSearchService literatureSearchService;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Override
    @Transactional
    public UUID save(String owner, String query, FetchResult result) {
        requireOwner(owner);
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Session query cannot be empty");
        }
        log.debug("Saving search session for owner {}: '{}' ({} articles)", owner, query, result.articles().size());

        List<Article> snapshot = result.articles().stream()
            .limit(sessionProperties.snapshotSize())
            .map(article -> article.shortened(sessionProperties.maxTextLength()))
            .toList();

        SearchSession saved = sessionRepository.save(new SearchSession(
            null,
            owner,
            query,
            Instant.now(clock),
            result.totalCount(),
            snapshot,
            result.tokens()
        ));

        log.info("Saved search session {} with {} snapshot articles", saved.id(), snapshot.size());
        return saved.id();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionSummary> list(String owner, int limit) {
        requireOwner(owner);
        int effectiveLimit = Math.min(Math.max(limit, 1), sessionProperties.listLimit());
        return sessionRepository.findByOwner(owner, effectiveLimit);
    }

    @Override
    @Transactional(readOnly = true)
    public SearchSession get(String owner, UUID id) {
        requireOwner(owner);
        log.debug("Attempting to find search session {} for owner {}", id, owner);

        return sessionRepository.findByIdAndOwner(id, owner)
            .orElseThrow(() -> {
                log.warn("Search session not found for ID: {}", id);
                return new SessionNotFoundException(id);
            });
    }

    @Override
    @Transactional
    public void delete(String owner, UUID id) {
        requireOwner(owner);
        int deleted = sessionRepository.deleteByIdAndOwner(id, owner);
        log.info("Delete of search session {} removed {} row(s)", id, deleted);
    }

    @Override
    @Transactional
    public int clear(String owner) {
        requireOwner(owner);
        int deleted = sessionRepository.deleteAllByOwner(owner);
        log.info("Cleared {} search session(s) of owner {}", deleted, owner);
        return deleted;
    }

    @Override
    public SessionPage reload(String owner, UUID id, int pageSize, int offset) {
        SearchSession session = get(owner, id);

        if (session.tokens().isPresent()) {
            try {
                FetchResult page = literatureSearchService.page(session.tokens(), pageSize, offset, session.totalCount());
                return new SessionPage(session.id(), session.query(), false, page);
            } catch (TransportException | StructuralException e) {
                log.warn("Stored tokens of session {} were not accepted, resubmitting query: {}", id, e.getMessage());
            }
        } else {
            log.info("Session {} has no continuation tokens, resubmitting query", id);
        }

        FetchResult resubmitted = literatureSearchService.search(session.query(), pageSize, offset, RESUBMIT_SORT);
        return new SessionPage(session.id(), session.query(), true, resubmitted);
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Session owner cannot be empty");
        }
    }
}
