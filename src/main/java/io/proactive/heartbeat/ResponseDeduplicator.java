package io.proactive.heartbeat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Suppresses repeated heartbeat responses within a rolling window.
 *
 * <p>Keeps {@code sha256(trimmed response) -> last delivery instant} in memory. Expired entries
 * are swept on every check. State is lost on restart.</p>
 */
public class ResponseDeduplicator {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private final Duration window;
    private final Clock clock;
    private final Map<String, Instant> recentHashes = new HashMap<>();

    public ResponseDeduplicator(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /**
     * Returns true if the same response was seen within the window. Otherwise records it
     * as seen now and returns false.
     */
    public synchronized boolean isDuplicate(String response) {
        Instant now = clock.instant();
        cleanExpired(now);

        String hash = hash(response.trim());
        if (recentHashes.containsKey(hash)) {
            return true;
        }
        recentHashes.put(hash, now);
        return false;
    }

    /** Number of hashes currently remembered. */
    public synchronized int size() {
        return recentHashes.size();
    }

    private void cleanExpired(Instant now) {
        Instant cutoff = now.minus(window);
        recentHashes.values().removeIf(seen -> seen.isBefore(cutoff));
    }

    static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
