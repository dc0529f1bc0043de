package com.satoru.literature.service;

import com.satoru.literature.exception.ArticleNotFoundException;
import com.satoru.literature.exception.TransportException;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;
import com.satoru.literature.model.SubmitResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LiteratureSearchServiceImpl implements LiteratureSearchService {

    private final QuerySubmitter querySubmitter;
    private final RecordFetcher recordFetcher;
    private final RelatedRecordLinker relatedRecordLinker;
    private final SpellingSuggester spellingSuggester;

    @Override
    @Retryable(
        retryFor = TransportException.class,
        maxAttemptsExpression = "${app.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.retry.delay-ms:500}", multiplierExpression = "${app.retry.multiplier:2}")
    )
    public FetchResult search(String query, int pageSize, int offset, String sort) {
        log.debug("Searching PubMed for '{}' (pageSize={}, offset={}, sort={})", query, pageSize, offset, sort);

        SubmitResult submitted = querySubmitter.submit(query, pageSize, offset, sort);
        if (submitted.totalCount() == 0 || submitted.ids().isEmpty()) {
            return new FetchResult(submitted.totalCount(), List.of(), submitted.tokens());
        }

        FetchResult fetched;
        if (submitted.tokens().isPresent()) {
            fetched = recordFetcher.fetch(submitted.tokens(), pageSize, offset, submitted.totalCount());
        } else {
            log.warn("ESearch for '{}' returned no history tokens, fetching {} ids directly", query, submitted.ids().size());
            FetchResult byIds = recordFetcher.fetchByIds(submitted.ids());
            fetched = new FetchResult(submitted.totalCount(), byIds.articles(), ContinuationTokenPair.NONE);
        }

        log.info("Search '{}' returned {} of {} articles", query, fetched.articles().size(), fetched.totalCount());
        return fetched;
    }

    @Override
    @Retryable(
        retryFor = TransportException.class,
        maxAttemptsExpression = "${app.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.retry.delay-ms:500}", multiplierExpression = "${app.retry.multiplier:2}")
    )
    public FetchResult page(ContinuationTokenPair tokens, int pageSize, int offset, int totalCount) {
        return recordFetcher.fetch(tokens, pageSize, offset, totalCount);
    }

    @Override
    @Retryable(
        retryFor = TransportException.class,
        maxAttemptsExpression = "${app.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.retry.delay-ms:500}", multiplierExpression = "${app.retry.multiplier:2}")
    )
    public Article article(String pmid) {
        return recordFetcher.fetchByIds(List.of(pmid)).articles().stream()
            .findFirst()
            .orElseThrow(() -> {
                log.warn("Article not found for PMID: {}", pmid);
                return new ArticleNotFoundException(pmid);
            });
    }

    @Override
    @Retryable(
        retryFor = TransportException.class,
        maxAttemptsExpression = "${app.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.retry.delay-ms:500}", multiplierExpression = "${app.retry.multiplier:2}")
    )
    public FetchResult related(String pmid, int maxResults) {
        return relatedRecordLinker.related(pmid, maxResults);
    }

    @Override
    @Retryable(
        retryFor = TransportException.class,
        maxAttemptsExpression = "${app.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.retry.delay-ms:500}", multiplierExpression = "${app.retry.multiplier:2}")
    )
    public List<String> suggest(String query) {
        return spellingSuggester.suggest(query);
    }
}
