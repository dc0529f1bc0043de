package com.satoru.literature.infra;

import org.springframework.util.MultiValueMap;

import java.time.Duration;

/**
 * Raw HTTPS GET access to one E-utilities endpoint (esearch, efetch, elink, espell).
 * Implementations add the tool, contact and credential parameters to every request.
 */
public interface EutilsTransport {

    byte[] get(String utility, MultiValueMap<String, String> params, Duration deadline);
}
