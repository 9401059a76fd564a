package com.qualsim.core.tree;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.model.WorldSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical identity of a snapshot: sorted attribute paths, each with its sorted level set and trend.
 * Two snapshots have the same fingerprint exactly when they hold the same values.
 */
public final class Fingerprint {

    private Fingerprint() {}

    public static String of(WorldSnapshot snapshot) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical(snapshot).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonical(WorldSnapshot snapshot) {
        Map<String, AttributeValue> sorted = new TreeMap<>();
        for (Map.Entry<AttributePath, AttributeValue> entry : snapshot.values().entrySet()) {
            sorted.put(entry.getKey().toString(), entry.getValue());
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, AttributeValue> entry : sorted.entrySet()) {
            List<String> levels = new ArrayList<>(entry.getValue().levels());
            levels.sort(null);
            sb.append(entry.getKey())
                    .append('=')
                    .append(String.join(",", levels))
                    .append('|')
                    .append(entry.getValue().trend().id())
                    .append(';');
        }
        return sb.toString();
    }
}
