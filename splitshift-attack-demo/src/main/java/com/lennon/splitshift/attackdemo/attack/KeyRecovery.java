package com.lennon.splitshift.attackdemo.attack;

import com.lennon.splitshift.alphabet.Alphabet;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.spi.ShiftEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known-plaintext key recovery (demo only).
 * Every key pair acts like its residues mod 26, so 26*26 candidates cover the
 * whole keyspace.
 */
public final class KeyRecovery {
    private static final Logger log = LoggerFactory.getLogger(KeyRecovery.class);

    private final ShiftEngine engine;

    public KeyRecovery(ShiftEngine engine) {
        this.engine = engine;
    }

    /**
     * Tries every residue pair in order (shift1 major) and returns the first
     * one that maps every known plaintext to its ciphertext.
     */
    public Optional<ShiftKeys> recover(List<Map.Entry<String, String>> knownPairs) {
        log.info("Start brute-force: candidates={}, knownPairs={}", Alphabet.RADIX * Alphabet.RADIX, knownPairs.size());
        int tried = 0;
        for (int s1 = 0; s1 < Alphabet.RADIX; s1++) {
            for (int s2 = 0; s2 < Alphabet.RADIX; s2++) {
                tried++;
                ShiftKeys cand = ShiftKeys.of(s1, s2);
                if (consistent(cand, knownPairs)) {
                    log.info("Found keys {} after {} candidates", cand, tried);
                    return Optional.of(cand);
                }
            }
        }
        log.info("No match found in keyspace");
        return Optional.empty();
    }

    private boolean consistent(ShiftKeys cand, List<Map.Entry<String, String>> knownPairs) {
        for (Map.Entry<String, String> p : knownPairs) {
            if (!engine.encrypt(p.getKey(), cand).equals(p.getValue())) {
                return false;
            }
        }
        return true;
    }
}
