package com.tollgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.cache.RequestFingerprinter;
import com.tollgate.cache.ResponseCache;
import com.tollgate.provider.CompletionProvider;
import com.tollgate.provider.LlmProvider;
import com.tollgate.service.ProviderService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Response cache and provider routing.
 */
@Configuration
public class CacheConfiguration {

    private final TollgateProperties properties;

    public CacheConfiguration(TollgateProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderService providerService(List<CompletionProvider> providers) {
        return new ProviderService(providers, LlmProvider.fromId(properties.getDefaultProvider()));
    }

    @Bean
    public RequestFingerprinter requestFingerprinter(ObjectMapper objectMapper, ProviderService providerService) {
        return new RequestFingerprinter(objectMapper, providerService::getDefaultProvider);
    }

    @Bean
    public ResponseCache responseCache(RequestFingerprinter fingerprinter, Clock clock) {
        TollgateProperties.CacheConfig cache = properties.getCache();
        return new ResponseCache(fingerprinter, clock, cache.getTtl(), cache.getMaxSize());
    }
}
