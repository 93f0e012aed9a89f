package com.lennon.splitshift.core;

import com.lennon.splitshift.spi.ShiftEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Splits long input into fixed-size chunks and encodes them in parallel.
 * Characters never depend on their neighbours, so the joined result equals
 * the sequential one.
 */
public final class ChunkedTransformer {
    private final ShiftEngine engine;
    private final int chunkSize;

    public ChunkedTransformer(ShiftEngine engine, int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        this.engine = Objects.requireNonNull(engine, "engine null");
        this.chunkSize = chunkSize;
    }

    public TaggedText encodeTagged(String text, ShiftKeys keys) {
        Objects.requireNonNull(text, "text null");
        Objects.requireNonNull(keys, "keys null");
        int length = text.length();
        int chunks = chunkCount(length, chunkSize);
        if (chunks <= 1) return engine.encryptTagged(text, keys);

        List<TaggedText> parts = IntStream.range(0, chunks)
                .parallel()
                .mapToObj(i -> engine.encryptTagged(
                        text.substring(i * chunkSize, chunkEnd(length, chunkSize, i)), keys))
                .collect(Collectors.toList());

        StringBuilder joined = new StringBuilder(text.length());
        List<Category> tags = new ArrayList<>(text.length());
        for (TaggedText part : parts) {
            joined.append(part.text());
            tags.addAll(part.tags());
        }
        return new TaggedText(joined.toString(), tags);
    }

    public String encode(String text, ShiftKeys keys) {
        return encodeTagged(text, keys).text();
    }

    public int getChunkSize() { return chunkSize; }

    // long arithmetic: length + chunkSize overflows int near Integer.MAX_VALUE
    static int chunkCount(int length, int chunkSize) {
        return (int) (((long) length + chunkSize - 1) / chunkSize);
    }

    static int chunkEnd(int length, int chunkSize, int i) {
        return (int) Math.min((long) length, ((long) i + 1) * chunkSize);
    }
}
