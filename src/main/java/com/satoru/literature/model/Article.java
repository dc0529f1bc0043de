package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Article(
    String pmid,
    String title,
    List<String> authors,
    String journal,
    String year,
    @JsonProperty("pub_date") String pubDate,
    @JsonProperty("abstract") String abstractText,
    @JsonProperty("abstract_sections") Map<String, String> abstractSections,
    String doi,
    String url
) {

    public static final String PUBMED_URL_TEMPLATE = "https://pubmed.ncbi.nlm.nih.gov/%s/";

    public Article {
        if (pmid == null || pmid.isBlank()) {
            throw new IllegalArgumentException("Article identifier cannot be empty");
        }
        authors = authors == null ? List.of() : List.copyOf(authors);
        abstractSections = abstractSections == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(abstractSections));
    }

    public static String urlFor(String pmid) {
        return String.format(PUBMED_URL_TEMPLATE, pmid);
    }

    /**
     * Copy with body and section texts cut to {@code maxLength} characters.
     */
    public Article shortened(int maxLength) {
        Map<String, String> sections = new LinkedHashMap<>();
        abstractSections.forEach((label, text) -> sections.put(label, shorten(text, maxLength)));
        return new Article(pmid, title, authors, journal, year, pubDate,
            shorten(abstractText, maxLength), sections, doi, url);
    }

    private static String shorten(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
