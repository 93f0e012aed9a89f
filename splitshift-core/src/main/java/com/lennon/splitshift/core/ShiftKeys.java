package com.lennon.splitshift.core;

import com.lennon.splitshift.alphabet.Alphabet;

/**
 * The key pair {@code (shift1, shift2)}. Any int is accepted; the four rule
 * amounts are computed in long and normalized to [0, 26).
 */
public final class ShiftKeys {
    private final int shift1;
    private final int shift2;

    private ShiftKeys(int shift1, int shift2) {
        this.shift1 = shift1;
        this.shift2 = shift2;
    }

    public static ShiftKeys of(int shift1, int shift2) {
        return new ShiftKeys(shift1, shift2);
    }

    /**
     * Parses {@code "s1,s2"} (whitespace around either number is ignored).
     */
    public static ShiftKeys parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("shift keys empty");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("shift keys must look like 's1,s2': " + text);
        }
        try {
            return new ShiftKeys(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad shift keys: " + text, e);
        }
    }

    public int shift1() { return shift1; }

    public int shift2() { return shift2; }

    /** shift1 * shift2, applied forward to a-m. */
    public int lowerFirstShift() {
        return Alphabet.mod26((long) shift1 * shift2);
    }

    /** -(shift1 + shift2), applied to n-z. */
    public int lowerSecondShift() {
        return Alphabet.mod26(-((long) shift1 + shift2));
    }

    /** -shift1, applied to A-M. */
    public int upperFirstShift() {
        return Alphabet.mod26(-(long) shift1);
    }

    /** shift2 squared, applied to N-Z. */
    public int upperSecondShift() {
        return Alphabet.mod26((long) shift2 * shift2);
    }

    /** The same keys reduced to [0, 26); every transform result is unchanged. */
    public ShiftKeys residues() {
        return new ShiftKeys(Alphabet.mod26(shift1), Alphabet.mod26(shift2));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShiftKeys)) return false;
        ShiftKeys other = (ShiftKeys) o;
        return shift1 == other.shift1 && shift2 == other.shift2;
    }

    @Override
    public int hashCode() {
        return 31 * shift1 + shift2;
    }

    @Override
    public String toString() {
        return shift1 + "," + shift2;
    }
}
