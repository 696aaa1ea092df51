package dev.cuadrada.infrastructure.storage;

import dev.cuadrada.config.StorageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStorageTest {

    @TempDir
    Path root;

    private FileStorage storage;

    @BeforeEach
    void setUp() {
        storage = new FileStorage(new StorageProperties(root.resolve("uploads"), root.resolve("results")));
        storage.ensureDirectories();
    }

    @Test
    @DisplayName("uploads are stored under the submission id with a sanitized name")
    void storeUpload() throws IOException {
        Path stored = storage.storeUpload("20240611_aa", "../../etc/my paper?.pdf", new byte[]{1, 2});

        assertThat(stored.getParent()).isEqualTo(root.resolve("uploads").toAbsolutePath().normalize());
        assertThat(stored.getFileName().toString()).isEqualTo("20240611_aa_my paper_.pdf");
        assertThat(Files.readAllBytes(stored)).containsExactly(1, 2);
        assertThat(storage.deleteUpload(stored)).isTrue();
        assertThat(stored).doesNotExist();
    }

    @Test
    @DisplayName("result lookups refuse traversal and separators")
    void unsafeNames() {
        assertThat(storage.findResult("../secret")).isEmpty();
        assertThat(storage.findResult("a/b.pdf")).isEmpty();
        assertThat(storage.findResult("a\\b.pdf")).isEmpty();
        assertThat(storage.findResult("")).isEmpty();
        assertThat(storage.findResult(null)).isEmpty();
        assertThatThrownBy(() -> storage.resultPath("..")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("existing results resolve, missing ones do not")
    void findResult() throws IOException {
        Files.write(storage.resultPath("cert.pdf"), new byte[]{9});

        assertThat(storage.findResult("cert.pdf")).isPresent();
        assertThat(storage.findResult("other.pdf")).isEmpty();
    }

    @Test
    @DisplayName("bundle contains the existing artifacts only")
    void zipResults() throws IOException {
        Files.writeString(storage.resultPath("a.pdf"), "A");
        Files.writeString(storage.resultPath("b.pdf"), "B");

        byte[] zip = storage.zipResults(List.of("a.pdf", "missing.pdf", "b.pdf"));

        List<String> names = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) names.add(entry.getName());
        }
        assertThat(names).containsExactly("a.pdf", "b.pdf");
    }

    @Test
    @DisplayName("blank upload names fall back to paper.pdf")
    void sanitize() {
        assertThat(FileStorage.sanitizeFilename(null)).isEqualTo("paper.pdf");
        assertThat(FileStorage.sanitizeFilename("C:\\docs\\thesis.pdf")).isEqualTo("thesis.pdf");
    }
}
