package com.satoru.literature.service;

import com.satoru.literature.config.EutilsProperties;
import com.satoru.literature.decoder.EutilsXml;
import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.RateGovernor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpellingSuggesterImpl implements SpellingSuggester {

    static final String ESPELL = "espell";

    private final RateGovernor rateGovernor;
    private final EutilsTransport transport;
    private final EutilsProperties properties;

    @Override
    public List<String> suggest(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("db", "pubmed");
        params.add("term", query);
        params.add("retmode", "xml");

        rateGovernor.acquire();
        Element root = EutilsXml.parseRoot(transport.get(ESPELL, params, properties.requestTimeout()), "eSpellResult");

        List<String> suggestions = EutilsXml.descendants(root, "CorrectedQuery").stream()
            .map(EutilsXml::text)
            .flatMap(Optional::stream)
            .filter(suggestion -> !suggestion.equalsIgnoreCase(query.trim()))
            .distinct()
            .toList();
        log.debug("ESpell for '{}' suggested {}", query, suggestions);
        return suggestions;
    }
}
