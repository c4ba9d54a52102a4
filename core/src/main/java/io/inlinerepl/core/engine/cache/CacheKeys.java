package io.inlinerepl.core.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-addressed cache keys: SHA-256 of the source text, a {@code |} separator and the
 * canonical JSON of the options that change transform output.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {
        // utility class
    }

    /** Output-affecting subset of the options, keys in sorted order. */
    public static Map<String, Object> outputOptions(SourceProgram source, TransformOptions options) {
        Map<String, Object> subset = new TreeMap<>();
        subset.put("internalLogLevel", options.internalLogLevel().id());
        subset.put("language", source.language().id());
        subset.put("loopProtection", options.loopProtection());
        subset.put("magicComments", options.magicComments());
        subset.put("showTopLevelResults", options.showTopLevelResults());
        return subset;
    }

    /** Canonical JSON of the output-affecting options. */
    public static String canonicalOptions(SourceProgram source, TransformOptions options) {
        try {
            return CANONICAL.writeValueAsString(outputOptions(source, options));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cache key options", e);
        }
    }

    /** Hex-encoded cache key for a source and its options. */
    public static String keyOf(SourceProgram source, TransformOptions options) {
        String material = source.text() + "|" + canonicalOptions(source, options);
        return sha256Hex(material);
    }

    static String sha256Hex(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
