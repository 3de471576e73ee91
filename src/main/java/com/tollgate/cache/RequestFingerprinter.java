package com.tollgate.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.model.CompletionRequest;
import com.tollgate.provider.LlmProvider;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Derives stable cache keys from completion requests.
 *
 * Only the fields that change the generated text take part: prompt, resolved
 * provider, temperature, max tokens, top-p, stop sequences and system text.
 * Keys are sorted and nulls dropped, so field order never matters; values are
 * hashed exactly as given, so any value difference yields a different key.
 */
public class RequestFingerprinter {

    public static final double DEFAULT_TEMPERATURE = 0.7;

    private final ObjectMapper objectMapper;
    private final Supplier<LlmProvider> defaultProvider;

    public RequestFingerprinter(ObjectMapper objectMapper, Supplier<LlmProvider> defaultProvider) {
        this.objectMapper = objectMapper;
        this.defaultProvider = defaultProvider;
    }

    /**
     * Generate the cache key for a request.
     *
     * @param request completion request
     * @return SHA-256 hash (64 hex chars)
     */
    public String fingerprint(CompletionRequest request) {
        return DigestUtils.sha256Hex(canonicalize(request));
    }

    /**
     * Canonical JSON string for the key-relevant fields of a request.
     */
    public String canonicalize(CompletionRequest request) {
        LlmProvider provider = request.getProvider() != null ? request.getProvider() : defaultProvider.get();
        double temperature = request.getTemperature() != null ? request.getTemperature() : DEFAULT_TEMPERATURE;

        // Sorted so field order never reaches the key
        TreeMap<String, Object> fields = new TreeMap<>();
        fields.put("prompt", request.getPrompt() == null ? "" : request.getPrompt());
        fields.put("provider", provider.getId());
        fields.put("temperature", temperature);
        if (request.getMaxTokens() != null) {
            fields.put("maxTokens", request.getMaxTokens());
        }
        if (request.getTopP() != null) {
            fields.put("topP", request.getTopP());
        }
        if (request.getStopSequences() != null) {
            fields.put("stopSequences", request.getStopSequences());
        }
        if (request.getSystem() != null) {
            fields.put("system", request.getSystem());
        }

        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache key fields", e);
        }
    }
}
