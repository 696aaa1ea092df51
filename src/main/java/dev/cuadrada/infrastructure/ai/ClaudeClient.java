package dev.cuadrada.infrastructure.ai;

import dev.cuadrada.config.AiProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single-model call to the review backend through Spring AI's {@link ChatModel}.
 *
 * <p>Kept as its own bean so the Resilience4j annotations are applied by the
 * Spring proxy: transient failures (5xx, I/O) are retried with exponential
 * backoff, while client errors such as an unknown model or a rate-limit answer
 * surface immediately and let {@link AiModelRouter} move to the next model.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    private final ChatModel chatModel;
    private final AiProperties aiProperties;

    public ClaudeClient(ChatModel chatModel, AiProperties aiProperties) {
        this.chatModel = chatModel;
        this.aiProperties = aiProperties;
    }

    @Retry(name = "claude")
    @CircuitBreaker(name = "claude")
    @RateLimiter(name = "claude")
    public String complete(String model, String systemPrompt, String userContent) {
        log.debug("Calling model {} ({} chars of input)", model, userContent.length());
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .temperature(aiProperties.temperature())
                .maxTokens(aiProperties.maxOutputTokens())
                .build();
        ChatResponse response = chatModel.call(new Prompt(
                List.of(new SystemMessage(systemPrompt), new UserMessage(userContent)), options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null)
            return null;
        return response.getResult().getOutput().getText();
    }
}
