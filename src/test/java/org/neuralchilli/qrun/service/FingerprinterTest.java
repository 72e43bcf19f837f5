package org.neuralchilli.qrun.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprinterTest {

    @TempDir
    Path baseDir;

    private Fingerprinter fingerprinter;

    @BeforeEach
    void setup() throws IOException {
        fingerprinter = new Fingerprinter(new FileResolver(baseDir));
        Files.writeString(baseDir.resolve("a.txt"), "alpha");
        Files.writeString(baseDir.resolve("b.txt"), "beta");
    }

    @Test
    void shouldBeStableForSameContent() {
        String first = fingerprinter.fingerprint(List.of("*.txt"));
        String second = fingerprinter.fingerprint(List.of("*.txt"));

        assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void shouldNotDependOnPatternOrder() {
        String forward = fingerprinter.fingerprint(List.of("a.txt", "b.txt"));
        String backward = fingerprinter.fingerprint(List.of("b.txt", "a.txt"));

        assertThat(forward).isEqualTo(backward);
    }

    @Test
    void shouldChangeWhenContentChanges() throws IOException {
        String before = fingerprinter.fingerprint(List.of("*.txt"));
        Files.writeString(baseDir.resolve("a.txt"), "ALPHA");

        assertThat(fingerprinter.fingerprint(List.of("*.txt"))).isNotEqualTo(before);
    }

    @Test
    void shouldChangeWhenFileIsRenamed() throws IOException {
        String before = fingerprinter.fingerprint(List.of("*.txt"));
        Files.move(baseDir.resolve("a.txt"), baseDir.resolve("c.txt"));

        assertThat(fingerprinter.fingerprint(List.of("*.txt"))).isNotEqualTo(before);
    }

    @Test
    void shouldSeparatePathFromContent() throws IOException {
        // Same concatenated bytes, different split between path and content
        Files.writeString(baseDir.resolve("ab"), "c");
        Files.writeString(baseDir.resolve("a"), "bc");

        assertThat(fingerprinter.fingerprint(List.of("ab")))
                .isNotEqualTo(fingerprinter.fingerprint(List.of("a")));
    }

    @Test
    void shouldFingerprintEmptySetAsEmptyDigest() {
        assertThat(fingerprinter.fingerprint(List.of("missing.txt")))
                .isEqualTo(Fingerprinter.emptyFingerprint())
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
