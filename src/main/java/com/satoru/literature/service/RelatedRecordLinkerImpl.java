package com.satoru.literature.service;

import com.satoru.literature.config.EutilsProperties;
import com.satoru.literature.decoder.EutilsXml;
import com.satoru.literature.exception.StructuralException;
import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.RateGovernor;
import com.satoru.literature.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.w3c.dom.Element;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.satoru.literature.decoder.EutilsXml.childText;
import static com.satoru.literature.decoder.EutilsXml.children;

@Slf4j
@Service
@RequiredArgsConstructor
public class RelatedRecordLinkerImpl implements RelatedRecordLinker {

    static final String ELINK = "elink";
    static final String LINK_NAME = "pubmed_pubmed";

    private final RateGovernor rateGovernor;
    private final EutilsTransport transport;
    private final RecordFetcher recordFetcher;
    private final EutilsProperties properties;

    @Override
    public FetchResult related(String pmid, int maxResults) {
        return related(pmid, maxResults, properties.requestTimeout());
    }

    @Override
    public FetchResult related(String pmid, int maxResults, Duration deadline) {
        if (pmid == null || pmid.isBlank()) {
            throw new IllegalArgumentException("PMID cannot be empty");
        }
        if (maxResults < 1) {
            return FetchResult.empty();
        }

        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("dbfrom", "pubmed");
        params.add("db", "pubmed");
        params.add("id", pmid.trim());
        params.add("linkname", LINK_NAME);
        params.add("retmode", "xml");
        params.add("retmax", String.valueOf(maxResults));

        rateGovernor.acquire();
        List<String> relatedIds = parseLinkedIds(transport.get(ELINK, params, deadline), pmid.trim(), maxResults);

        if (relatedIds.isEmpty()) {
            log.info("No related articles found for PMID {}", pmid);
            return FetchResult.empty();
        }

        log.debug("ELink found {} related ids for PMID {}", relatedIds.size(), pmid);
        return recordFetcher.fetchByIds(relatedIds, deadline);
    }

    private List<String> parseLinkedIds(byte[] payload, String sourceId, int maxResults) {
        Element root = EutilsXml.parseRoot(payload, "eLinkResult");
        childText(root, "ERROR").ifPresent(error -> {
            throw new StructuralException("ELink reported an error: " + error);
        });

        Set<String> ids = new LinkedHashSet<>();
        for (Element linkSet : children(root, "LinkSet")) {
            for (Element linkSetDb : children(linkSet, "LinkSetDb")) {
                String linkName = childText(linkSetDb, "LinkName").orElse(LINK_NAME);
                if (!LINK_NAME.equals(linkName)) {
                    continue;
                }
                for (Element link : children(linkSetDb, "Link")) {
                    childText(link, "Id")
                        .filter(id -> !id.equals(sourceId))
                        .ifPresent(ids::add);
                }
            }
        }
        return ids.stream().limit(maxResults).toList();
    }
}
