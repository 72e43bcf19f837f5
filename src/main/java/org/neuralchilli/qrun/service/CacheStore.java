package org.neuralchilli.qrun.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads and saves the fingerprint cache as JSON.
 * <p>
 * A missing or unreadable cache file is an empty cache, never an error.
 * Write failures are logged as warnings and do not affect the run's outcome.
 */
@ApplicationScoped
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    static final int FORMAT_VERSION = 1;

    @ConfigProperty(name = "qrun.cache.file-name", defaultValue = "qrun_cache.json")
    String cacheFileName;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public CacheStore() {
    }

    public CacheStore(String cacheFileName) {
        this.cacheFileName = cacheFileName;
    }

    /**
     * Locate the cache file: {@code cacheDir} is taken relative to the config
     * file's directory unless it is absolute; no {@code cacheDir} means the
     * config directory itself.
     */
    public Path resolveCachePath(Path configFile, String cacheDir) {
        Path configParent = configFile.toAbsolutePath().getParent();
        if (configParent == null) {
            configParent = Path.of("").toAbsolutePath();
        }

        Path directory;
        if (cacheDir == null || cacheDir.isBlank()) {
            directory = configParent;
        } else if (Path.of(cacheDir).isAbsolute()) {
            directory = Path.of(cacheDir);
        } else {
            directory = configParent.resolve(cacheDir);
        }

        return directory.resolve(cacheFileName).normalize();
    }

    public IncrementalCache load(Path cacheFile) {
        try {
            CacheFile file = objectMapper.readValue(Files.readAllBytes(cacheFile), CacheFile.class);
            List<String> entries = file != null && file.fingerprints() != null
                    ? file.fingerprints()
                    : List.of();
            log.debug("Loaded {} cached fingerprints from {}", entries.size(), cacheFile);
            return new IncrementalCache(entries);
        } catch (NoSuchFileException e) {
            log.debug("No cache file at {}, starting empty", cacheFile);
            return new IncrementalCache();
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", cacheFile, e.getMessage());
            return new IncrementalCache();
        }
    }

    /**
     * Overwrite the cache file with the current entries.
     *
     * @return true if the file was written
     */
    public boolean save(IncrementalCache cache, Path cacheFile) {
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.warn("Failed to create cache directory for {}: {}", cacheFile, e.getMessage());
            return false;
        }

        try {
            objectMapper.writeValue(cacheFile.toFile(), new CacheFile(FORMAT_VERSION, cache.fingerprints()));
            log.debug("Saved {} fingerprints to {}", cache.size(), cacheFile);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write cache file {}: {}", cacheFile, e.getMessage());
            return false;
        }
    }

    record CacheFile(int version, List<String> fingerprints) {
    }
}
