package com.satoru.literature.service;

import com.satoru.literature.config.EutilsProperties;
import com.satoru.literature.decoder.PubmedArticleDecoder;
import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.RateGovernor;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.Duration;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecordFetcherImpl implements RecordFetcher {

    static final String EFETCH = "efetch";

    private static final int UNKNOWN_TOTAL = -1;

    private final RateGovernor rateGovernor;
    private final EutilsTransport transport;
    private final PubmedArticleDecoder decoder;
    private final EutilsProperties properties;

    @Override
    public FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset) {
        return fetch(tokens, pageSize, offset, UNKNOWN_TOTAL, properties.requestTimeout());
    }

    @Override
    public FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset, int knownTotal) {
        return fetch(tokens, pageSize, offset, knownTotal, properties.requestTimeout());
    }

    @Override
    public FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset, int knownTotal, Duration deadline) {
        if (tokens == null || !tokens.isPresent()) {
            throw new IllegalArgumentException("Fetching by window needs a WebEnv and query_key");
        }
        if (pageSize < 1 || offset < 0) {
            throw new IllegalArgumentException("Page size must be positive and offset non-negative");
        }

        MultiValueMap<String, String> params = baseParams();
        params.add("WebEnv", tokens.webEnv());
        params.add("query_key", tokens.queryKey());
        params.add("retstart", String.valueOf(offset));
        params.add("retmax", String.valueOf(pageSize));

        rateGovernor.acquire();
        List<Article> articles = decoder.decode(transport.get(EFETCH, params, deadline));
        if (articles.size() > pageSize) {
            articles = articles.subList(0, pageSize);
        }

        // Without a known total the window end is the best lower bound available.
        int total = knownTotal >= 0 ? knownTotal : offset + articles.size();
        log.debug("EFetch window [{}, +{}] returned {} articles", offset, pageSize, articles.size());
        return new FetchResult(total, articles, tokens);
    }

    @Override
    public FetchResult fetchByIds(List<String> ids) {
        return fetchByIds(ids, properties.requestTimeout());
    }

    @Override
    public FetchResult fetchByIds(List<String> ids, Duration deadline) {
        List<String> cleanIds = ids == null ? List.of() : ids.stream()
            .filter(id -> id != null && !id.isBlank())
            .map(String::trim)
            .toList();
        if (cleanIds.isEmpty()) {
            return FetchResult.empty();
        }

        MultiValueMap<String, String> params = baseParams();
        params.add("id", String.join(",", cleanIds));

        rateGovernor.acquire();
        List<Article> articles = decoder.decode(transport.get(EFETCH, params, deadline));

        log.debug("EFetch for {} ids returned {} articles", cleanIds.size(), articles.size());
        return new FetchResult(articles.size(), articles, ContinuationTokenPair.NONE);
    }

    private MultiValueMap<String, String> baseParams() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("db", "pubmed");
        params.add("rettype", "abstract");
        params.add("retmode", "xml");
        return params;
    }
}
