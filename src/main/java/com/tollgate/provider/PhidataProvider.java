package com.tollgate.provider;

import com.tollgate.config.TollgateProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Phidata completion provider.
 */
@Component
public class PhidataProvider extends AbstractCompletionProvider {

    public PhidataProvider(WebClient webClient, TollgateProperties properties) {
        super(webClient, properties, LlmProvider.PHIDATA);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.PHIDATA;
    }

    @Override
    protected String completionPath() {
        return "/completions";
    }
}
