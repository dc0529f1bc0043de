package com.satoru.literature.controller;

import com.satoru.literature.exception.WrongQueryException;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;
import com.satoru.literature.service.LiteratureSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

    private static final Set<String> SORT_ORDERS = Set.of(
        "relevance", "pub_date", "Author", "JournalName", "first_author", "journal", "title");

    private final LiteratureSearchService literatureSearchService;

    @GetMapping
    public ResponseEntity<FetchResult> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "page_size", defaultValue = "10") int pageSize,
        @RequestParam(name = "offset", defaultValue = "0") int offset,
        @RequestParam(name = "sort", defaultValue = "relevance") String sort) {

        QueryChecks.paging(pageSize, offset);
        if (!SORT_ORDERS.contains(sort)) {
            throw new WrongQueryException("Unsupported sort order: " + sort);
        }
        return ResponseEntity.ok(literatureSearchService.search(QueryChecks.query(query), pageSize, offset, sort));
    }

    @GetMapping("/page")
    public ResponseEntity<FetchResult> page(
        @RequestParam(name = "web_env") String webEnv,
        @RequestParam(name = "query_key") String queryKey,
        @RequestParam(name = "page_size", defaultValue = "10") int pageSize,
        @RequestParam(name = "offset", defaultValue = "0") int offset,
        @RequestParam(name = "total_count", defaultValue = "-1") int totalCount) {

        QueryChecks.paging(pageSize, offset);
        ContinuationTokenPair tokens = ContinuationTokenPair.of(webEnv, queryKey);
        if (!tokens.isPresent()) {
            throw new WrongQueryException("web_env and query_key are both required");
        }
        return ResponseEntity.ok(literatureSearchService.page(tokens, pageSize, offset, totalCount));
    }

    @GetMapping("/spelling")
    public ResponseEntity<SpellingResponse> spelling(@RequestParam(name = "q") String query) {
        String checked = QueryChecks.query(query);
        return ResponseEntity.ok(new SpellingResponse(checked, literatureSearchService.suggest(checked)));
    }
}
