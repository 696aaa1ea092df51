package dev.cuadrada.integration;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for integration tests.
 *
 * <p>Runs the full application against a real PostgreSQL from Testcontainers so
 * the Flyway schema, the unique constraints and the compare-and-set updates are
 * exercised as in production. Skipped when Docker is not available.
 *
 * <p>The review backend is never called: subclasses mock the model router.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("cuadrada_test")
            .withUsername("test")
            .withPassword("test");

    static final Path STORAGE = createStorage();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);

        registry.add("spring.ai.anthropic.api-key", () -> "test-key");
        registry.add("cuadrada.storage.upload-folder", () -> STORAGE.resolve("uploads").toString());
        registry.add("cuadrada.storage.results-folder", () -> STORAGE.resolve("results").toString());
        registry.add("cuadrada.review.timeout", () -> "PT20S");
    }

    private static Path createStorage() {
        try {
            return Files.createTempDirectory("cuadrada-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
