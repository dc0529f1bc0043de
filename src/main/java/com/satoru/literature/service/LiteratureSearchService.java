package com.satoru.literature.service;

import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;

import java.util.List;

/**
 * Caller-level entry point over the E-utilities components. Transport failures are retried here
 * and nowhere below.
 */
public interface LiteratureSearchService {
    FetchResult search(String query, int pageSize, int offset, String sort);
    FetchResult page(ContinuationTokenPair tokens, int pageSize, int offset, int totalCount);
    Article article(String pmid);
    FetchResult related(String pmid, int maxResults);
    List<String> suggest(String query);
}
