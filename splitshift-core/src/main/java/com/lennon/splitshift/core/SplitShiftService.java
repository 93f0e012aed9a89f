package com.lennon.splitshift.core;

import com.lennon.splitshift.spi.ShiftEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for callers.
 *
 * API:
 *  - encode / encodeWithMetadata
 *  - decodeWithMetadata (exact, needs the metadata written at encode time)
 *  - decodeHeuristic (no metadata, may be wrong, see {@link com.lennon.splitshift.spi.SplitShiftEngine})
 *  - verify (round trip through the metadata path)
 *
 * Every method has an {@code (int, int)} form and a {@link ShiftKeys} form.
 * Persisting ciphertext and metadata is up to the caller; the two strings must
 * be kept aligned character for character.
 */
public final class SplitShiftService {
    private static final Logger log = LoggerFactory.getLogger(SplitShiftService.class);

    private final ShiftEngine engine;

    public SplitShiftService() {
        this(SplitShift.build());
    }

    public SplitShiftService(ShiftEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine null");
    }

    // ---------- encode ----------

    public String encode(String text, int shift1, int shift2) {
        return encode(text, ShiftKeys.of(shift1, shift2));
    }

    public String encode(String text, ShiftKeys keys) {
        return engine.encrypt(text, keys);
    }

    public TaggedText encodeWithMetadata(String text, int shift1, int shift2) {
        return encodeWithMetadata(text, ShiftKeys.of(shift1, shift2));
    }

    public TaggedText encodeWithMetadata(String text, ShiftKeys keys) {
        return engine.encryptTagged(text, keys);
    }

    // ---------- decode ----------

    /**
     * @throws MetadataLengthMismatchException if cipher and metadata differ in length
     */
    public String decodeWithMetadata(String cipher, String metadata, int shift1, int shift2) {
        return decodeWithMetadata(cipher, metadata, ShiftKeys.of(shift1, shift2));
    }

    public String decodeWithMetadata(String cipher, String metadata, ShiftKeys keys) {
        return engine.decrypt(cipher, metadata, keys);
    }

    public String decodeWithMetadata(TaggedText tagged, ShiftKeys keys) {
        Objects.requireNonNull(tagged, "tagged null");
        return engine.decrypt(tagged.text(), tagged.metadata(), keys);
    }

    public String decodeHeuristic(String cipher, int shift1, int shift2) {
        return decodeHeuristic(cipher, ShiftKeys.of(shift1, shift2));
    }

    public String decodeHeuristic(String cipher, ShiftKeys keys) {
        return engine.decryptHeuristic(cipher, keys);
    }

    // ---------- verify ----------

    /**
     * Encodes with metadata, decodes again and compares with the input.
     */
    public boolean verify(String text, ShiftKeys keys) {
        TaggedText tagged = encodeWithMetadata(text, keys);
        String back = decodeWithMetadata(tagged, keys);
        boolean ok = text.equals(back);
        if (!ok) {
            log.warn("Round trip failed for keys {}: expected {} chars, decoded '{}'", keys, text.length(), back);
        } else {
            log.debug("Round trip ok for keys {} ({} chars)", keys, text.length());
        }
        return ok;
    }

    /**
     * Encodes and wraps the result together with a digest of {@code text}.
     */
    public CipherEnvelope seal(String text, ShiftKeys keys) {
        return CipherEnvelope.seal(encodeWithMetadata(text, keys), text);
    }

    /**
     * Decodes an envelope; the caller checks {@link CipherEnvelope#matches(String)}
     * when the digest matters.
     */
    public String open(CipherEnvelope envelope, ShiftKeys keys) {
        Objects.requireNonNull(envelope, "envelope null");
        return decodeWithMetadata(envelope.getCiphertext(), envelope.getMetadata(), keys);
    }
}
