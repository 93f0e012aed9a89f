package com.lennon.splitshift.spi;

import com.lennon.splitshift.alphabet.Alphabet;
import com.lennon.splitshift.core.Category;
import com.lennon.splitshift.core.MetadataLengthMismatchException;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.TaggedText;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-character engine: every output char depends only on the input char and
 * the keys, never on its neighbours, so results are length preserving.
 */
public final class SplitShiftEngine implements ShiftEngine {
    private final Alphabet lower = Alphabet.of(Alphabet.Kind.LOWER);
    private final Alphabet upper = Alphabet.of(Alphabet.Kind.UPPER);

    @Override
    public String encrypt(String plain, ShiftKeys keys) {
        Objects.requireNonNull(plain, "plain null");
        Objects.requireNonNull(keys, "keys null");
        char[] arr = plain.toCharArray();
        for (int i=0;i<arr.length;i++){
            arr[i] = Category.classify(arr[i]).encrypt(arr[i], keys);
        }
        return new String(arr);
    }

    @Override
    public TaggedText encryptTagged(String plain, ShiftKeys keys) {
        Objects.requireNonNull(plain, "plain null");
        Objects.requireNonNull(keys, "keys null");
        char[] arr = plain.toCharArray();
        List<Category> tags = new ArrayList<>(arr.length);
        for (int i=0;i<arr.length;i++){
            Category cat = Category.classify(arr[i]);
            arr[i] = cat.encrypt(arr[i], keys);
            tags.add(cat);
        }
        return new TaggedText(new String(arr), tags);
    }

    @Override
    public String decrypt(String cipher, String metadata, ShiftKeys keys) {
        Objects.requireNonNull(cipher, "cipher null");
        Objects.requireNonNull(metadata, "metadata null");
        Objects.requireNonNull(keys, "keys null");
        if (cipher.length() != metadata.length()) {
            throw new MetadataLengthMismatchException(cipher.length(), metadata.length());
        }
        char[] arr = cipher.toCharArray();
        for (int i=0;i<arr.length;i++){
            // 只看 metadata，不看密文字符本身
            arr[i] = Category.fromCode(metadata.charAt(i)).decrypt(arr[i], keys);
        }
        return new String(arr);
    }

    /**
     * Best effort without metadata: take the first-half inverse if it lands in
     * the first half, otherwise the second-half inverse, unchecked. Wrong
     * whenever a second-half letter encrypts onto the image of the first half.
     */
    @Override
    public String decryptHeuristic(String cipher, ShiftKeys keys) {
        Objects.requireNonNull(cipher, "cipher null");
        Objects.requireNonNull(keys, "keys null");
        char[] arr = cipher.toCharArray();
        for (int i=0;i<arr.length;i++){
            arr[i] = guess(arr[i], keys);
        }
        return new String(arr);
    }

    private char guess(char c, ShiftKeys keys) {
        if (lower.contains(c)) {
            char first = Category.LOWER_FIRST.decrypt(c, keys);
            return lower.inFirstHalf(first) ? first : Category.LOWER_SECOND.decrypt(c, keys);
        }
        if (upper.contains(c)) {
            char first = Category.UPPER_FIRST.decrypt(c, keys);
            return upper.inFirstHalf(first) ? first : Category.UPPER_SECOND.decrypt(c, keys);
        }
        return c;
    }
}
