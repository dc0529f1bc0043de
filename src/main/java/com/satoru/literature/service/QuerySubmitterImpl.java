package com.satoru.literature.service;

import com.satoru.literature.config.EutilsProperties;
import com.satoru.literature.decoder.EutilsXml;
import com.satoru.literature.exception.StructuralException;
import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.RateGovernor;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.SubmitResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.w3c.dom.Element;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.satoru.literature.decoder.EutilsXml.child;
import static com.satoru.literature.decoder.EutilsXml.childText;
import static com.satoru.literature.decoder.EutilsXml.children;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuerySubmitterImpl implements QuerySubmitter {

    static final String ESEARCH = "esearch";

    private final RateGovernor rateGovernor;
    private final EutilsTransport transport;
    private final EutilsProperties properties;

    @Override
    public SubmitResult submit(String query, int pageSize, int offset, String sort) {
        return submit(query, pageSize, offset, sort, properties.requestTimeout());
    }

    @Override
    public SubmitResult submit(String query, int pageSize, int offset, String sort, Duration deadline) {
        if (pageSize < 1 || offset < 0) {
            throw new IllegalArgumentException("Page size must be positive and offset non-negative");
        }

        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("db", "pubmed");
        params.add("term", query);
        params.add("retmax", String.valueOf(pageSize));
        params.add("retstart", String.valueOf(offset));
        if (sort != null && !sort.isBlank()) {
            params.add("sort", sort);
        }
        params.add("retmode", "xml");
        params.add("usehistory", "y");

        rateGovernor.acquire();
        byte[] payload = transport.get(ESEARCH, params, deadline);

        SubmitResult result = parse(payload, pageSize);
        log.debug("ESearch for '{}' matched {} records, page of {} ids", query, result.totalCount(), result.ids().size());
        return result;
    }

    private SubmitResult parse(byte[] payload, int pageSize) {
        Element root = EutilsXml.parseRoot(payload, "eSearchResult");

        String count = childText(root, "Count").orElseThrow(() -> new StructuralException(
            "ESearch response has no Count" + childText(root, "ERROR").map(e -> ": " + e).orElse("")));
        int totalCount;
        try {
            totalCount = Integer.parseInt(count);
        } catch (NumberFormatException e) {
            throw new StructuralException("ESearch Count is not a number: " + count, e);
        }

        List<String> ids = child(root, "IdList")
            .map(idList -> children(idList, "Id").stream()
                .map(EutilsXml::text)
                .flatMap(Optional::stream)
                .limit(pageSize)
                .toList())
            .orElse(List.of());

        ContinuationTokenPair tokens = ContinuationTokenPair.of(
            childText(root, "WebEnv").orElse(null),
            childText(root, "QueryKey").orElse(null));

        return new SubmitResult(totalCount, ids, tokens);
    }
}
