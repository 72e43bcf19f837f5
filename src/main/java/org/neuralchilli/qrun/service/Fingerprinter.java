package org.neuralchilli.qrun.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Content-addressed digest of a set of input files.
 * <p>
 * Each file contributes {@code SHA-256("<path length>:<path>" + content)};
 * the per-file digests, taken in lexicographic path order, are concatenated
 * and hashed once more. The result depends only on the (path, content) pairs.
 * <p>
 * Unreadable files are skipped with a warning rather than failing the
 * fingerprint, so a run can proceed; their content is then invisible to the cache.
 */
public class Fingerprinter {

    private static final Logger log = LoggerFactory.getLogger(Fingerprinter.class);

    private static final String ALGORITHM = "SHA-256";

    private final FileResolver fileResolver;

    public Fingerprinter(FileResolver fileResolver) {
        this.fileResolver = fileResolver;
    }

    /**
     * Resolve the patterns and fingerprint the matching files.
     *
     * @return lowercase hex digest
     * @throws FileException if a pattern cannot be resolved
     */
    public String fingerprint(List<String> inputPatterns) {
        return fingerprintFiles(fileResolver.resolveInputs(inputPatterns));
    }

    /**
     * Fingerprint already-resolved files.
     */
    public String fingerprintFiles(List<Path> files) {
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(Path::toString));

        List<byte[]> digests = new ArrayList<>(sorted.size());
        for (Path file : sorted) {
            byte[] contents;
            try {
                contents = Files.readAllBytes(fileResolver.toAbsolute(file));
            } catch (IOException e) {
                log.warn("Could not read file '{}': {}", file, e.getMessage());
                continue;
            }

            byte[] pathBytes = file.toString().getBytes(StandardCharsets.UTF_8);
            MessageDigest digest = newDigest();
            digest.update((pathBytes.length + ":").getBytes(StandardCharsets.UTF_8));
            digest.update(pathBytes);
            digest.update(contents);
            digests.add(digest.digest());
        }

        MessageDigest combined = newDigest();
        for (byte[] fileDigest : digests) {
            combined.update(fileDigest);
        }
        return HexFormat.of().formatHex(combined.digest());
    }

    /**
     * Digest of an empty byte sequence; the fingerprint of an empty file set.
     */
    public static String emptyFingerprint() {
        return HexFormat.of().formatHex(newDigest().digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
