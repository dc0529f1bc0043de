package com.satoru.literature.decoder;

import com.satoru.literature.model.Article;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.satoru.literature.decoder.EutilsXml.child;
import static com.satoru.literature.decoder.EutilsXml.childText;
import static com.satoru.literature.decoder.EutilsXml.children;
import static com.satoru.literature.decoder.EutilsXml.descendants;
import static com.satoru.literature.decoder.EutilsXml.firstDescendant;
import static com.satoru.literature.decoder.EutilsXml.firstDescendantText;
import static com.satoru.literature.decoder.EutilsXml.text;

/**
 * Decodes an EFetch {@code PubmedArticleSet} into {@link Article}s.
 * A broken article is dropped; only an unparsable document is an error.
 */
@Slf4j
@Component
public class PubmedArticleDecoder {

    public static final String ROOT = "PubmedArticleSet";
    public static final String NO_TITLE = "No title available";
    public static final String NO_ABSTRACT = "No abstract available";
    public static final String UNKNOWN_JOURNAL = "Unknown Journal";

    public List<Article> decode(byte[] payload) {
        Element root = EutilsXml.parseRoot(payload, ROOT);

        List<Element> containers = children(root, "PubmedArticle");
        List<Article> articles = new ArrayList<>(containers.size());
        int skipped = 0;

        for (Element container : containers) {
            try {
                Optional<Article> article = decodeArticle(container);
                if (article.isPresent()) {
                    articles.add(article.get());
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping malformed PubmedArticle: {}", e.getMessage());
                skipped++;
            }
        }

        if (skipped > 0) {
            log.warn("Decoded {} of {} PubMed articles, {} skipped as malformed",
                articles.size(), containers.size(), skipped);
        }
        return articles;
    }

    private Optional<Article> decodeArticle(Element container) {
        Optional<Element> citation = child(container, "MedlineCitation");
        Optional<String> pmid = citation.flatMap(c -> childText(c, "PMID"));
        if (pmid.isEmpty()) {
            return Optional.empty();
        }

        Element article = firstDescendant(container, "Article").orElse(container);

        String title = firstDescendantText(article, "ArticleTitle").orElse(NO_TITLE);
        String journal = firstDescendant(article, "Journal")
            .flatMap(j -> childText(j, "Title"))
            .orElse(UNKNOWN_JOURNAL);

        Optional<Element> pubDate = firstDescendant(article, "PubDate");
        String year = pubDate.flatMap(this::year).orElse("");
        String date = pubDate.map(this::publicationDate).orElse(year);

        AbstractParts abstractParts = abstractParts(article);

        return Optional.of(new Article(
            pmid.get(),
            title,
            authors(article),
            journal,
            year,
            date,
            abstractParts.body(),
            abstractParts.sections(),
            doi(container, article),
            Article.urlFor(pmid.get())
        ));
    }

    private List<String> authors(Element article) {
        List<String> authors = new ArrayList<>();
        Optional<Element> authorList = firstDescendant(article, "AuthorList");
        if (authorList.isEmpty()) {
            return authors;
        }
        for (Element author : children(authorList.get(), "Author")) {
            if ("N".equals(author.getAttribute("ValidYN"))) {
                continue;
            }
            Optional<String> lastName = childText(author, "LastName");
            if (lastName.isPresent()) {
                authors.add(childText(author, "Initials")
                    .map(initials -> lastName.get() + " " + initials)
                    .orElse(lastName.get()));
            } else {
                childText(author, "CollectiveName").ifPresent(authors::add);
            }
        }
        return authors;
    }

    private Optional<String> year(Element pubDate) {
        Optional<String> year = childText(pubDate, "Year");
        if (year.isPresent()) {
            return year;
        }
        return childText(pubDate, "MedlineDate")
            .filter(medline -> medline.length() >= 4)
            .map(medline -> medline.substring(0, 4));
    }

    private String publicationDate(Element pubDate) {
        Optional<String> year = childText(pubDate, "Year");
        if (year.isEmpty()) {
            return childText(pubDate, "MedlineDate").orElse("");
        }
        String month = childText(pubDate, "Month").orElse("");
        return (month + " " + year.get()).trim();
    }

    private AbstractParts abstractParts(Element article) {
        Optional<Element> abstractElement = child(article, "Abstract")
            .or(() -> firstDescendant(article, "Abstract"));
        List<Element> parts = abstractElement
            .map(a -> children(a, "AbstractText"))
            .orElse(List.of());

        Map<String, String> sections = new LinkedHashMap<>();
        List<String> unlabeled = new ArrayList<>();
        for (Element part : parts) {
            String label = part.getAttribute("Label").trim();
            String content = text(part).orElse("");
            if (label.isEmpty()) {
                if (!content.isEmpty()) {
                    unlabeled.add(content);
                }
            } else {
                // A repeated label keeps its first position; the texts are joined in document order.
                sections.merge(label.toUpperCase(), content, (existing, more) -> (existing + " " + more).trim());
            }
        }

        if (sections.isEmpty()) {
            String body = String.join(" ", unlabeled);
            return new AbstractParts(body.isEmpty() ? NO_ABSTRACT : body, Map.of());
        }

        String labeled = sections.entrySet().stream()
            .map(section -> section.getKey() + ": " + section.getValue())
            .collect(Collectors.joining(" "));
        String body = unlabeled.isEmpty() ? labeled : String.join(" ", unlabeled) + " " + labeled;
        return new AbstractParts(body, sections);
    }

    private String doi(Element container, Element article) {
        Optional<String> fromIdList = child(container, "PubmedData")
            .flatMap(data -> child(data, "ArticleIdList"))
            .flatMap(ids -> children(ids, "ArticleId").stream()
                .filter(id -> "doi".equals(id.getAttribute("IdType")))
                .findFirst())
            .flatMap(EutilsXml::text);
        if (fromIdList.isPresent()) {
            return fromIdList.get();
        }
        return descendants(article, "ELocationID").stream()
            .filter(id -> "doi".equals(id.getAttribute("EIdType")))
            .findFirst()
            .flatMap(EutilsXml::text)
            .orElse(null);
    }

    private record AbstractParts(String body, Map<String, String> sections) {}
}
