package com.tollgate.provider;

import com.tollgate.config.TollgateProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Groq chat completion provider (OpenAI-compatible endpoint).
 */
@Component
public class GroqProvider extends AbstractCompletionProvider {

    public GroqProvider(WebClient webClient, TollgateProperties properties) {
        super(webClient, properties, LlmProvider.GROQ);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GROQ;
    }

    @Override
    protected String completionPath() {
        return "/chat/completions";
    }
}
