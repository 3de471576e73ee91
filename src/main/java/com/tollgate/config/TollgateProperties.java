package com.tollgate.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Tollgate.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tollgate")
public class TollgateProperties {

    private String defaultProvider = "groq";
    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private ProxyConfig proxy = new ProxyConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;
    }

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofSeconds(300);
        private int maxSize = 100;
        private Duration pruneInterval = Duration.ofSeconds(60);
    }

    @Slf4j
    @Data
    public static class AdmissionConfig {

        public static final int DEFAULT_MAX_THREADS = 8;

        /**
         * Raw ceiling, usually sourced from MAX_THREADS. Kept as text so a
         * malformed value degrades to the default instead of failing binding.
         */
        private String maxThreads = String.valueOf(DEFAULT_MAX_THREADS);

        public int resolveCapacity() {
            return parseCapacity(maxThreads);
        }

        static int parseCapacity(String raw) {
            if (raw == null || raw.isBlank()) {
                return DEFAULT_MAX_THREADS;
            }
            try {
                int parsed = Integer.parseInt(raw.trim());
                if (parsed >= 1) {
                    return parsed;
                }
                log.warn("Ignoring non-positive max-threads value {}, using {}", parsed, DEFAULT_MAX_THREADS);
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparsable max-threads value '{}', using {}", raw, DEFAULT_MAX_THREADS);
            }
            return DEFAULT_MAX_THREADS;
        }
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
    }
}
