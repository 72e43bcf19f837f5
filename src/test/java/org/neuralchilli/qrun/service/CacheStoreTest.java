package org.neuralchilli.qrun.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStoreTest {

    @TempDir
    Path tempDir;

    private final CacheStore store = new CacheStore("qrun_cache.json");

    @Test
    void shouldResolveCacheDirAgainstConfigDirectory() {
        Path configFile = tempDir.resolve("qrun.yaml");

        assertThat(store.resolveCachePath(configFile, ".qrun"))
                .isEqualTo(tempDir.toAbsolutePath().resolve(".qrun/qrun_cache.json").normalize());
        assertThat(store.resolveCachePath(configFile, null))
                .isEqualTo(tempDir.toAbsolutePath().resolve("qrun_cache.json").normalize());
    }

    @Test
    void shouldKeepAbsoluteCacheDir() {
        Path elsewhere = tempDir.resolve("elsewhere").toAbsolutePath();

        assertThat(store.resolveCachePath(tempDir.resolve("qrun.yaml"), elsewhere.toString()))
                .isEqualTo(elsewhere.resolve("qrun_cache.json"));
    }

    @Test
    void shouldSaveAndReloadFingerprints() {
        Path cacheFile = tempDir.resolve("nested/dir/qrun_cache.json");
        IncrementalCache cache = new IncrementalCache(List.of("bbb", "aaa"));

        assertThat(store.save(cache, cacheFile)).isTrue();

        IncrementalCache loaded = store.load(cacheFile);
        assertThat(loaded.fingerprints()).containsExactly("aaa", "bbb");
    }

    @Test
    void shouldWriteVersionedJson() throws IOException {
        Path cacheFile = tempDir.resolve("qrun_cache.json");
        store.save(new IncrementalCache(List.of("abc")), cacheFile);

        String json = Files.readString(cacheFile);
        assertThat(json).contains("\"version\" : 1").contains("\"abc\"");
    }

    @Test
    void shouldStartEmptyWhenFileIsMissing() {
        assertThat(store.load(tempDir.resolve("absent.json")).isEmpty()).isTrue();
    }

    @Test
    void shouldStartEmptyWhenFileIsCorrupt() throws IOException {
        Path cacheFile = tempDir.resolve("qrun_cache.json");
        Files.writeString(cacheFile, "{not json");

        assertThat(store.load(cacheFile).isEmpty()).isTrue();
    }

    @Test
    void shouldReportFailureWhenTargetIsADirectory() throws IOException {
        Path cacheFile = Files.createDirectories(tempDir.resolve("qrun_cache.json"));

        assertThat(store.save(new IncrementalCache(List.of("abc")), cacheFile)).isFalse();
    }
}
