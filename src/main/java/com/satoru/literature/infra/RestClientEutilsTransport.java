package com.satoru.literature.infra;

import com.satoru.literature.config.EutilsProperties;
import com.satoru.literature.exception.RateLimitExceededException;
import com.satoru.literature.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class RestClientEutilsTransport implements EutilsTransport {

    private final RestClient restClient;
    private final EutilsProperties properties;
    private final AsyncTaskExecutor executor;

    public RestClientEutilsTransport(RestClient restClient, EutilsProperties properties, AsyncTaskExecutor executor) {
        this.restClient = restClient;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public byte[] get(String utility, MultiValueMap<String, String> params, Duration deadline) {
        MultiValueMap<String, String> query = withIdentity(params);
        long deadlineMillis = deadline.toMillis();

        log.debug("E-utilities {} request with params {}", utility, params);

        Future<byte[]> call;
        try {
            call = executor.submit(() -> execute(utility, query));
        } catch (RejectedExecutionException e) {
            log.warn("E-utilities {} call rejected by the executor: {}", utility, e.getMessage());
            throw new TransportException("E-utilities " + utility + " call could not be scheduled", e);
        }

        try {
            byte[] body = call.get(deadlineMillis, TimeUnit.MILLISECONDS);
            return body == null ? new byte[0] : body;
        } catch (TimeoutException e) {
            // Interrupts the worker so the pending HTTP exchange is abandoned and the thread freed.
            call.cancel(true);
            log.warn("E-utilities {} call timed out after {} ms", utility, deadlineMillis);
            throw TransportException.timeout(utility, deadlineMillis, e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for E-utilities " + utility, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException transportException) {
                throw transportException;
            }
            log.warn("E-utilities {} call failed: {}", utility, cause.getMessage());
            throw new TransportException("E-utilities " + utility + " call failed: " + cause.getMessage(), cause);
        }
    }

    private byte[] execute(String utility, MultiValueMap<String, String> query) {
        try {
            return restClient.get()
                .uri(buildUri(utility, query))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    if (response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                        throw new RateLimitExceededException(utility);
                    }
                    throw new TransportException(
                        "E-utilities " + utility + " answered with status " + response.getStatusCode().value(),
                        response.getStatusCode().value());
                })
                .body(byte[].class);
        } catch (RestClientException e) {
            throw new TransportException("E-utilities " + utility + " request failed: " + e.getMessage(), e);
        }
    }

    // Form-style encoding: spaces become '+', a literal '+' becomes %2B.
    private URI buildUri(String utility, MultiValueMap<String, String> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.baseUrl())
            .path("/" + utility + ".fcgi");
        query.forEach((name, values) -> values.forEach(value ->
            builder.queryParam(encode(name), encode(value))));
        return builder.build(true).toUri();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private MultiValueMap<String, String> withIdentity(MultiValueMap<String, String> params) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>(params);
        query.set("tool", properties.tool());
        query.set("email", properties.email());
        if (properties.hasApiKey()) {
            query.set("api_key", properties.apiKey());
        }
        return query;
    }
}
