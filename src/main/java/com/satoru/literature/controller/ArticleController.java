package com.satoru.literature.controller;

import com.satoru.literature.exception.WrongQueryException;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.FetchResult;
import com.satoru.literature.service.LiteratureSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Pattern;

@RestController
@RequestMapping("/articles")
@RequiredArgsConstructor
public class ArticleController {

    static final int MAX_RELATED = 20;
    private static final Pattern PMID = Pattern.compile("\\d{1,10}");

    private final LiteratureSearchService literatureSearchService;

    @GetMapping("/{pmid}")
    public ResponseEntity<Article> getArticle(@PathVariable String pmid) {
        return ResponseEntity.ok(literatureSearchService.article(checkPmid(pmid)));
    }

    @GetMapping("/{pmid}/related")
    public ResponseEntity<FetchResult> getRelated(
        @PathVariable String pmid,
        @RequestParam(name = "max_results", defaultValue = "10") int maxResults) {

        if (maxResults < 1 || maxResults > MAX_RELATED) {
            throw new WrongQueryException("max_results must be between 1 and " + MAX_RELATED);
        }
        return ResponseEntity.ok(literatureSearchService.related(checkPmid(pmid), maxResults));
    }

    private static String checkPmid(String pmid) {
        if (!PMID.matcher(pmid).matches()) {
            throw new WrongQueryException("Not a PubMed identifier: " + pmid);
        }
        return pmid;
    }
}
