package com.lennon.splitshift.core;

import com.lennon.splitshift.alphabet.Alphabet;

/**
 * Which of the four shift rules (or none) applies to a character.
 * The tag plus the keys is all that is needed to invert the character.
 */
public enum Category {
    LOWER_FIRST('l', Alphabet.Kind.LOWER) {
        @Override
        public int forwardShift(ShiftKeys keys) { return keys.lowerFirstShift(); }
    },
    LOWER_SECOND('L', Alphabet.Kind.LOWER) {
        @Override
        public int forwardShift(ShiftKeys keys) { return keys.lowerSecondShift(); }
    },
    UPPER_FIRST('u', Alphabet.Kind.UPPER) {
        @Override
        public int forwardShift(ShiftKeys keys) { return keys.upperFirstShift(); }
    },
    UPPER_SECOND('U', Alphabet.Kind.UPPER) {
        @Override
        public int forwardShift(ShiftKeys keys) { return keys.upperSecondShift(); }
    },
    PASSTHROUGH('0', null) {
        @Override
        public int forwardShift(ShiftKeys keys) { return 0; }

        @Override
        public char encrypt(char c, ShiftKeys keys) { return c; }

        @Override
        public char decrypt(char c, ShiftKeys keys) { return c; }
    };

    private final char code;
    private final Alphabet.Kind kind;

    Category(char code, Alphabet.Kind kind) {
        this.code = code;
        this.kind = kind;
    }

    /** Forward shift in [0, 26) for this rule. */
    public abstract int forwardShift(ShiftKeys keys);

    public char code() { return code; }

    // null for PASSTHROUGH, which overrides encrypt/decrypt
    private Alphabet alphabet() {
        return kind == null ? null : Alphabet.of(kind);
    }

    public char encrypt(char c, ShiftKeys keys) {
        return alphabet().shift(c, forwardShift(keys));
    }

    public char decrypt(char c, ShiftKeys keys) {
        return alphabet().shift(c, -forwardShift(keys));
    }

    /** Case-sensitive, ASCII letters only; everything else passes through. */
    public static Category classify(char c) {
        if (c >= 'a' && c <= 'z') {
            return c <= 'm' ? LOWER_FIRST : LOWER_SECOND;
        }
        if (c >= 'A' && c <= 'Z') {
            return c <= 'M' ? UPPER_FIRST : UPPER_SECOND;
        }
        return PASSTHROUGH;
    }

    /**
     * Maps a metadata code back to its category. Unknown codes are read as
     * {@link #PASSTHROUGH}, same as {@code '0'}.
     */
    public static Category fromCode(char code) {
        switch (code) {
            case 'l': return LOWER_FIRST;
            case 'L': return LOWER_SECOND;
            case 'u': return UPPER_FIRST;
            case 'U': return UPPER_SECOND;
            default:  return PASSTHROUGH;
        }
    }
}
