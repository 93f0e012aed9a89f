package com.lennon.splitshift.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ciphertext plus the category that produced each of its characters.
 * {@link #metadata()} is the persisted form: one code per character
 * ('l', 'L', 'u', 'U', '0').
 */
public final class TaggedText {
    private final String text;
    private final List<Category> tags;

    public TaggedText(String text, List<Category> tags) {
        Objects.requireNonNull(text, "text null");
        Objects.requireNonNull(tags, "tags null");
        if (text.length() != tags.size()) {
            throw new MetadataLengthMismatchException(text.length(), tags.size());
        }
        this.text = text;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    /**
     * Rebuilds a tagged text from stored ciphertext and metadata.
     *
     * @throws MetadataLengthMismatchException if the two strings differ in length
     */
    public static TaggedText of(String text, String metadata) {
        Objects.requireNonNull(text, "text null");
        Objects.requireNonNull(metadata, "metadata null");
        if (text.length() != metadata.length()) {
            throw new MetadataLengthMismatchException(text.length(), metadata.length());
        }
        List<Category> tags = new ArrayList<>(metadata.length());
        for (int i = 0; i < metadata.length(); i++) {
            tags.add(Category.fromCode(metadata.charAt(i)));
        }
        return new TaggedText(text, tags);
    }

    public String text() { return text; }

    public List<Category> tags() { return tags; }

    public int length() { return text.length(); }

    public String metadata() {
        StringBuilder sb = new StringBuilder(tags.size());
        for (Category c : tags) sb.append(c.code());
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaggedText)) return false;
        TaggedText that = (TaggedText) o;
        return text.equals(that.text) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, tags);
    }

    @Override
    public String toString() {
        return "TaggedText{text='" + text + "', metadata='" + metadata() + "'}";
    }
}
