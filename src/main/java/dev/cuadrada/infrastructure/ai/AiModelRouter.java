package dev.cuadrada.infrastructure.ai;

import dev.cuadrada.config.AiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Routes a review request along the configured model chain.
 *
 * <p>Fallback chain (default):
 * <ul>
 *   <li>claude-3-5-sonnet → claude-3-opus → claude-3-sonnet → claude-3-haiku</li>
 * </ul>
 *
 * <p>Any failure of a model (unknown model, rate limit, retries exhausted,
 * open circuit, blank answer) moves on to the next one. The model that answered
 * is reported back so it can be stored with the decision.
 */
@Component
public class AiModelRouter {

    private static final Logger log = LoggerFactory.getLogger(AiModelRouter.class);

    private final List<String> models;
    private final ClaudeClient client;

    public AiModelRouter(AiProperties aiProperties, ClaudeClient client) {
        this.models = aiProperties.models();
        this.client = client;
    }

    public AiResponse review(String systemPrompt, String paperText) {
        Instant start = Instant.now();
        RuntimeException lastFailure = null;
        for (String model : models) {
            try {
                String content = client.complete(model, systemPrompt, paperText);
                if (content == null || content.isBlank()) {
                    lastFailure = new IllegalStateException("Empty answer from " + model);
                    log.warn("Model {} returned no text, trying next model", model);
                    continue;
                }
                log.info("Review generated with model {}", model);
                return new AiResponse(content, model, Duration.between(start, Instant.now()));
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Model {} failed, trying next model: {}", model, e.getMessage());
            }
        }
        String reason = lastFailure != null ? lastFailure.getMessage() : "no models configured";
        throw new ReviewBackendException(
                "AI service error after trying %d models: %s".formatted(models.size(), reason), lastFailure);
    }

    public record AiResponse(String content, String modelUsed, Duration latency) {}
}
