package com.satoru.literature.controller;

import com.satoru.literature.config.SecurityConfig;
import com.satoru.literature.exception.RateLimitExceededException;
import com.satoru.literature.exception.StructuralException;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;
import com.satoru.literature.service.LiteratureSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
@Import(SecurityConfig.class)
@WithMockUser(username = "researcher")
class SearchControllerTest {

    private static final ContinuationTokenPair TOKENS = ContinuationTokenPair.of("MCID_abc", "1");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LiteratureSearchService literatureSearchService;

    @Test
    @DisplayName("GET /search returns the page with snake_case fields")
    void searchShouldReturnPage() throws Exception {
        Article article = new Article("34567890", "Genetics of asthma", List.of("Smith J"), "Thorax", "2021",
            "Mar 2021", "Body", null, null, Article.urlFor("34567890"));
        when(literatureSearchService.search("asthma genetics", 10, 0, "relevance"))
            .thenReturn(new FetchResult(150, List.of(article), TOKENS));

        mockMvc.perform(get("/search").param("q", "asthma genetics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(150))
            .andExpect(jsonPath("$.articles[0].pmid").value("34567890"))
            .andExpect(jsonPath("$.articles[0].pub_date").value("Mar 2021"))
            .andExpect(jsonPath("$.articles[0].abstract").value("Body"))
            .andExpect(jsonPath("$.tokens.web_env").value("MCID_abc"))
            .andExpect(jsonPath("$.tokens.query_key").value("1"));
    }

    @Test
    @DisplayName("GET /search without q is a bad request")
    void searchShouldRequireQuery() throws Exception {
        mockMvc.perform(get("/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    @DisplayName("Invalid paging is rejected before searching")
    void searchShouldRejectInvalidPaging() throws Exception {
        mockMvc.perform(get("/search").param("q", "asthma").param("page_size", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/search").param("q", "asthma").param("offset", "-5"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/search").param("q", "asthma").param("sort", "random"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(literatureSearchService);
    }

    @Test
    @DisplayName("Transport failures map to 503")
    void transportFailureShouldBeServiceUnavailable() throws Exception {
        when(literatureSearchService.search("asthma", 10, 0, "relevance"))
            .thenThrow(new RateLimitExceededException("esearch"));

        mockMvc.perform(get("/search").param("q", "asthma"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    @DisplayName("Structural failures map to 502")
    void structuralFailureShouldBeBadGateway() throws Exception {
        when(literatureSearchService.search("asthma", 10, 0, "relevance"))
            .thenThrow(new StructuralException("Expected <eSearchResult> but got <html>"));

        mockMvc.perform(get("/search").param("q", "asthma"))
            .andExpect(status().isBadGateway());
    }

    @Test
    void pageShouldUseGivenTokens() throws Exception {
        when(literatureSearchService.page(TOKENS, 20, 40, 150)).thenReturn(new FetchResult(150, List.of(), TOKENS));

        mockMvc.perform(get("/search/page")
                .param("web_env", "MCID_abc")
                .param("query_key", "1")
                .param("page_size", "20")
                .param("offset", "40")
                .param("total_count", "150"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(150));

        verify(literatureSearchService).page(TOKENS, 20, 40, 150);
    }

    @Test
    void spellingShouldReturnSuggestions() throws Exception {
        when(literatureSearchService.suggest("asthmaa")).thenReturn(List.of("asthma"));

        mockMvc.perform(get("/search/spelling").param("q", "asthmaa"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.suggestions[0]").value("asthma"));
    }

    @Test
    void anonymousRequestShouldBeRejected() throws Exception {
        mockMvc.perform(get("/search").param("q", "asthma").with(anonymous()))
            .andExpect(status().isUnauthorized());
    }
}
