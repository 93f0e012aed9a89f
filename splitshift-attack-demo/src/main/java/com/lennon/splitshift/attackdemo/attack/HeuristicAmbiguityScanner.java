package com.lennon.splitshift.attackdemo.attack;

import com.lennon.splitshift.alphabet.Alphabet;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.spi.ShiftEngine;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Measures how often metadata-free decoding gets a letter wrong.
 */
public final class HeuristicAmbiguityScanner {
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final ShiftEngine engine;

    public HeuristicAmbiguityScanner(ShiftEngine engine) {
        this.engine = engine;
    }

    /** Letters that do not survive encrypt + heuristic decrypt under {@code keys}. */
    public SortedSet<Character> misdecodedLetters(ShiftKeys keys) {
        String back = engine.decryptHeuristic(engine.encrypt(LETTERS, keys), keys);
        SortedSet<Character> wrong = new TreeSet<>();
        for (int i = 0; i < LETTERS.length(); i++) {
            if (back.charAt(i) != LETTERS.charAt(i)) wrong.add(LETTERS.charAt(i));
        }
        return Collections.unmodifiableSortedSet(wrong);
    }

    /** Misdecoded-letter count for every residue pair. */
    public Map<ShiftKeys, Integer> scanResidues() {
        Map<ShiftKeys, Integer> out = new TreeMap<>((a, b) -> a.shift1() != b.shift1()
                ? Integer.compare(a.shift1(), b.shift1())
                : Integer.compare(a.shift2(), b.shift2()));
        for (int s1 = 0; s1 < Alphabet.RADIX; s1++) {
            for (int s2 = 0; s2 < Alphabet.RADIX; s2++) {
                ShiftKeys keys = ShiftKeys.of(s1, s2);
                out.put(keys, misdecodedLetters(keys).size());
            }
        }
        return out;
    }
}
