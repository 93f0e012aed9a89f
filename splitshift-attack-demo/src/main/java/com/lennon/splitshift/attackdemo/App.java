package com.lennon.splitshift.attackdemo;

import com.lennon.splitshift.attackdemo.attack.HeuristicAmbiguityScanner;
import com.lennon.splitshift.attackdemo.attack.KeyRecovery;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.SplitShift;
import com.lennon.splitshift.spi.ShiftEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Demo run:
 * 1) encrypt a known plaintext with "secret" keys
 * 2) recover equivalent keys by brute force over the residue keyspace
 * 3) report which letters metadata-free decoding gets wrong
 *
 * Run: mvn -q exec:java -pl splitshift-attack-demo
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        // demo parameters
        ShiftKeys secret = ShiftKeys.of(1_000_003, -77);
        String plain = "Meet Nora at the Zoo, bring Apples";

        ShiftEngine engine = SplitShift.build();
        String cipher = engine.encrypt(plain, secret);

        log.info("Secret keys (hidden) = {}", secret);
        log.info("Plain:  {}", plain);
        log.info("Cipher: {}", cipher);

        List<Map.Entry<String, String>> knownPairs = Arrays.asList(
                new AbstractMap.SimpleEntry<>(plain, cipher)
        );
        Optional<ShiftKeys> found = new KeyRecovery(engine).recover(knownPairs);
        if (found.isPresent()) {
            log.info("SUCCESS: recovered keys {} (secret residues {})", found.get(), secret.residues());
        } else {
            log.info("FAILED to recover keys");
        }

        HeuristicAmbiguityScanner scanner = new HeuristicAmbiguityScanner(engine);
        log.info("Heuristic decode misses for {}: {}", secret, scanner.misdecodedLetters(secret));

        Map<ShiftKeys, Integer> scan = scanner.scanResidues();
        long clean = scan.values().stream().filter(n -> n == 0).count();
        int worst = scan.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        log.info("Residue pairs with exact heuristic decode: {} of {}, worst case {} letters wrong",
                clean, scan.size(), worst);
    }
}
