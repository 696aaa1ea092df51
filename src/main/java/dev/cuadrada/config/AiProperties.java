package dev.cuadrada.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Backend routing config. models is the fallback chain, tried in order.
 */
@ConfigurationProperties(prefix = "cuadrada.ai")
public record AiProperties(List<String> models, int maxOutputTokens, double temperature, int maxInputChars) {
    public AiProperties {
        if (models == null || models.isEmpty()) {
            models = List.of("claude-3-5-sonnet-20240620", "claude-3-opus-20240229",
                    "claude-3-sonnet-20240229", "claude-3-haiku-20240307");
        }
        models = List.copyOf(models);
        if (maxOutputTokens <= 0) maxOutputTokens = 4000;
        if (temperature < 0) temperature = 0.2;
        if (maxInputChars <= 0) maxInputChars = 200_000;
    }
}
