package dev.cuadrada.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "cuadrada.storage")
public record StorageProperties(Path uploadFolder, Path resultsFolder) {
    public StorageProperties {
        if (uploadFolder == null) uploadFolder = Path.of("uploads");
        if (resultsFolder == null) resultsFolder = Path.of("results");
    }
}
