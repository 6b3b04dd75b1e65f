/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.model;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable identity of an alert derived from its label set. Label order does not affect the result.
 */
public final class Fingerprints {
    private static final char SEPARATOR = '\u00ff';

    private Fingerprints() {
    }

    @SuppressWarnings("UnstableApiUsage")
    public static String of(Map<String, String> labels) {
        Hasher hasher = Hashing.farmHashFingerprint64().newHasher();
        new TreeMap<>(labels).forEach((name, value) -> {
            hasher.putString(name, StandardCharsets.UTF_8);
            hasher.putChar(SEPARATOR);
            hasher.putString(value == null ? "" : value, StandardCharsets.UTF_8);
            hasher.putChar(SEPARATOR);
        });
        return String.format("%016x", hasher.hash().asLong());
    }
}
