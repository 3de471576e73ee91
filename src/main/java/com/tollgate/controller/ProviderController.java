package com.tollgate.controller;

import com.tollgate.provider.LlmProvider;
import com.tollgate.service.ProviderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Read and switch the process-wide default provider.
 */
@Slf4j
@RestController
@RequestMapping("/api/llm-provider")
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> getProvider() {
        return ResponseEntity.ok(Map.of("provider", providerService.getDefaultProvider().getId()));
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> setProvider(@RequestBody Map<String, String> body) {
        LlmProvider provider = LlmProvider.fromId(body.get("provider"));
        providerService.setDefaultProvider(provider);
        return ResponseEntity.ok(Map.of("provider", provider.getId()));
    }
}
