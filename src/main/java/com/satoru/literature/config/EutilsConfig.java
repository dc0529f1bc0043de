package com.satoru.literature.config;

import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.IntervalRateGovernor;
import com.satoru.literature.infra.RateGovernor;
import com.satoru.literature.infra.RestClientEutilsTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

@Slf4j
@Configuration
public class EutilsConfig {

    @Bean
    public RateGovernor eutilsRateGovernor(EutilsProperties properties) {
        log.info("E-utilities minimum request interval: {} (api key {})",
            properties.effectiveMinInterval(), properties.hasApiKey() ? "present" : "absent");
        return new IntervalRateGovernor(properties.effectiveMinInterval());
    }

    @Bean
    public RestClient eutilsRestClient(RestClient.Builder builder, EutilsProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.requestTimeout());
        return builder
            .requestFactory(requestFactory)
            .build();
    }

    @Bean
    public EutilsTransport eutilsTransport(
        RestClient eutilsRestClient,
        EutilsProperties properties,
        @Qualifier("eutilsTaskExecutor") ThreadPoolTaskExecutor eutilsTaskExecutor
    ) {
        return new RestClientEutilsTransport(eutilsRestClient, properties, eutilsTaskExecutor);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
