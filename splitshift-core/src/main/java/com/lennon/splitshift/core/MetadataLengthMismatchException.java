package com.lennon.splitshift.core;

/**
 * Ciphertext and metadata must line up one code per character.
 */
public class MetadataLengthMismatchException extends IllegalArgumentException {
    private final int cipherLength;
    private final int metadataLength;

    public MetadataLengthMismatchException(int cipherLength, int metadataLength) {
        super("Ciphertext and metadata lengths do not match: cipher=" + cipherLength
                + ", metadata=" + metadataLength);
        this.cipherLength = cipherLength;
        this.metadataLength = metadataLength;
    }

    public int getCipherLength() { return cipherLength; }

    public int getMetadataLength() { return metadataLength; }
}
