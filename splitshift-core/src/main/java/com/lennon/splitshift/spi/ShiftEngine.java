package com.lennon.splitshift.spi;

import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.TaggedText;

public interface ShiftEngine {
    String encrypt(String plain, ShiftKeys keys);
    TaggedText encryptTagged(String plain, ShiftKeys keys);
    String decrypt(String cipher, String metadata, ShiftKeys keys);
    String decryptHeuristic(String cipher, ShiftKeys keys);
}
