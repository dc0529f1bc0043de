package com.satoru.literature.service;

import com.satoru.literature.model.FetchResult;
import com.satoru.literature.model.SearchSession;
import com.satoru.literature.model.SessionPage;
import com.satoru.literature.model.SessionSummary;

import java.util.List;
import java.util.UUID;

/**
 * Saved searches of one owner. A session never becomes visible to another owner:
 * lookups and deletions with a foreign id behave as if the session did not exist.
 */
public interface SearchSessionService {

    UUID save(String owner, String query, FetchResult result);

    List<SessionSummary> list(String owner, int limit);

    SearchSession get(String owner, UUID id);

    void delete(String owner, UUID id);

    int clear(String owner);

    /**
     * Fetches a page of a stored search. When the stored continuation tokens are missing or no
     * longer accepted, the stored query text is submitted again and the page is marked resubmitted.
     */
    SessionPage reload(String owner, UUID id, int pageSize, int offset);
}
