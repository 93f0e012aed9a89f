package com.lennon.splitshift.alphabet;

import java.util.*;

public final class Alphabet {
    public enum Kind { LOWER, UPPER }

    public static final int RADIX = 26;
    public static final int HALF = RADIX / 2;

    private static final Alphabet LOWER_ALPHABET = new Alphabet("abcdefghijklmnopqrstuvwxyz".toCharArray());
    private static final Alphabet UPPER_ALPHABET = new Alphabet("ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray());

    private final char[] symbols;
    private final Map<Character,Integer> index;

    private Alphabet(char[] symbols) {
        if (symbols.length != RADIX) {
            throw new IllegalArgumentException("Alphabet must have " + RADIX + " symbols, got " + symbols.length);
        }
        this.symbols = symbols;
        this.index = new HashMap<>(symbols.length * 2);
        for (int i=0;i<symbols.length;i++){
            if (index.put(symbols[i], i) != null) {
                throw new IllegalArgumentException("Duplicate symbol in alphabet: " + symbols[i]);
            }
        }
    }

    public static Alphabet of(Kind kind){
        switch (kind){
            case LOWER:
                return LOWER_ALPHABET;
            case UPPER:
                return UPPER_ALPHABET;
            default:
                throw new IllegalArgumentException("Unknown kind: " + kind);
        }
    }

    /** Floored modulo: always in [0, 26), whatever the sign of n. */
    public static int mod26(long n){
        return (int) (((n % RADIX) + RADIX) % RADIX);
    }

    public int size(){ return symbols.length; }

    public boolean contains(char c){ return index.containsKey(c); }

    /** True for the first 13 symbols (a-m / A-M). */
    public boolean inFirstHalf(char c){
        Integer i = index.get(c);
        return i != null && i < HALF;
    }

    public boolean inSecondHalf(char c){
        Integer i = index.get(c);
        return i != null && i >= HALF;
    }

    public int idx(char c){
        Integer i = index.get(c);
        if (i == null) throw new IllegalArgumentException("Char not in alphabet: " + c);
        return i;
    }

    public char sym(long i){
        return symbols[mod26(i)];
    }

    /**
     * Moves {@code c} by {@code shift} positions, wrapping around.
     * Characters outside this alphabet come back unchanged.
     */
    public char shift(char c, long shift){
        Integer i = index.get(c);
        if (i == null) return c;
        return sym(i + (long) mod26(shift));
    }
}
