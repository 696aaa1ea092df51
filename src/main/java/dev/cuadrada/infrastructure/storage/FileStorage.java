package dev.cuadrada.infrastructure.storage;

import dev.cuadrada.config.StorageProperties;
import dev.cuadrada.exception.StorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Local filesystem storage for uploaded papers and generated artifacts.
 *
 * <p>Uploads live in the upload folder as {@code <submissionId>_<filename>}.
 * Certificates and per-reviewer reports live in the results folder and are
 * referenced by bare filename, which is what the download endpoint accepts.
 */
@Component
public class FileStorage {
    private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

    private final Path uploadFolder;
    private final Path resultsFolder;

    public FileStorage(StorageProperties properties) {
        this.uploadFolder = properties.uploadFolder().toAbsolutePath().normalize();
        this.resultsFolder = properties.resultsFolder().toAbsolutePath().normalize();
    }

    @PostConstruct
    public void ensureDirectories() {
        try {
            Files.createDirectories(uploadFolder);
            Files.createDirectories(resultsFolder);
            log.info("Storage ready: uploads={}, results={}", uploadFolder, resultsFolder);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage folders", e);
        }
    }

    public Path storeUpload(String submissionId, String filename, byte[] content) {
        String safeName = sanitizeFilename(filename);
        Path target = uploadFolder.resolve(submissionId + "_" + safeName).normalize();
        if (!target.startsWith(uploadFolder))
            throw new StorageException("Refusing to write outside upload folder: " + filename, null);
        try {
            Files.write(target, content);
            log.debug("Stored upload {} ({} bytes)", target, content.length);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to store upload " + safeName, e);
        }
    }

    /**
     * Best-effort removal of a stored upload; used when a submission is rolled back.
     */
    public boolean deleteUpload(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete upload {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Path where a results artifact with this name is (or will be) stored.
     */
    public Path resultPath(String filename) {
        if (!isSafeName(filename))
            throw new IllegalArgumentException("Invalid artifact name: " + filename);
        return resultsFolder.resolve(filename);
    }

    /**
     * Resolves an existing results artifact. Unsafe names (empty, "..", separators) resolve to empty.
     */
    public Optional<Path> findResult(String filename) {
        if (!isSafeName(filename)) return Optional.empty();
        Path path = resultsFolder.resolve(filename);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    public byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path.getFileName(), e);
        }
    }

    /**
     * Zips the named results artifacts that exist; missing names are skipped.
     */
    public byte[] zipResults(Collection<String> filenames) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (String name : filenames) {
                Optional<Path> path = findResult(name);
                if (path.isEmpty()) {
                    log.debug("Skipping missing artifact {} in bundle", name);
                    continue;
                }
                zip.putNextEntry(new ZipEntry(name));
                Files.copy(path.get(), zip);
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new StorageException("Failed to build archive", e);
        }
        return buffer.toByteArray();
    }

    static boolean isSafeName(String filename) {
        return filename != null && !filename.isBlank()
                && !filename.contains("..")
                && !filename.contains("/") && !filename.contains("\\");
    }

    static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) return "paper.pdf";
        String base = filename.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        base = base.replaceAll("[^A-Za-z0-9._ -]", "_").replace("..", "_");
        return base.isBlank() ? "paper.pdf" : base;
    }
}
