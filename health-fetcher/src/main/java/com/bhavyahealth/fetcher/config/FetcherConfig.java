package com.bhavyahealth.fetcher.config;

import com.bhavyahealth.fetcher.service.EndpointCatalog;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class FetcherConfig {

    public static final String API_RETRY = "bhavyaApi";

    @Bean
    public Clock fetcherClock(HealthFetcherProperties properties) {
        return Clock.system(ZoneId.of(properties.getFetch().getZone()));
    }

    @Bean
    public HttpClient bhavyaHttpClient(HealthFetcherProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getApi().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Retry policy comes from resilience4j.retry.instances.bhavyaApi in application.yml */
    @Bean
    public Retry bhavyaApiRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(API_RETRY);
    }

    @Bean
    public EndpointCatalog endpointCatalog() {
        return EndpointCatalog.bhavya();
    }
}
