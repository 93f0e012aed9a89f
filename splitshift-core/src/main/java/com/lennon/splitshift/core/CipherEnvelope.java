package com.lennon.splitshift.core;

import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Ciphertext, its metadata and the SHA-256 (hex) of the plaintext, carried as
 * one token:
 * <pre>
 *   base64url(utf8(ciphertext)) "." metadata "." sha256hex(utf8(plain))
 * </pre>
 * Metadata codes and hex never contain '.', and neither does URL-safe Base64.
 */
public final class CipherEnvelope {
    private static final char SEP = '.';
    private static final Base64 STRICT_URL_SAFE = new Base64(0, new byte[0], true, CodecPolicy.STRICT);

    private final String ciphertext;
    private final String metadata;
    private final String plainDigest;

    private CipherEnvelope(String ciphertext, String metadata, String plainDigest) {
        if (ciphertext.length() != metadata.length()) {
            throw new MetadataLengthMismatchException(ciphertext.length(), metadata.length());
        }
        this.ciphertext = ciphertext;
        this.metadata = metadata;
        this.plainDigest = plainDigest;
    }

    public static CipherEnvelope seal(TaggedText tagged, String plain) {
        Objects.requireNonNull(tagged, "tagged null");
        Objects.requireNonNull(plain, "plain null");
        return new CipherEnvelope(tagged.text(), tagged.metadata(), digest(plain));
    }

    public static CipherEnvelope parse(String token) {
        Objects.requireNonNull(token, "token null");
        int first = token.indexOf(SEP);
        int last = token.lastIndexOf(SEP);
        if (first < 0 || first == last) {
            throw new IllegalArgumentException("not an envelope token: " + token);
        }
        String body = token.substring(0, first);
        String metadata = token.substring(first + 1, last);
        String digest = token.substring(last + 1);
        if (digest.length() != 64 || !digest.matches("[0-9a-f]+")) {
            throw new IllegalArgumentException("bad digest in envelope: " + digest);
        }
        String ciphertext = new String(decodeBody(body), StandardCharsets.UTF_8);
        return new CipherEnvelope(ciphertext, metadata, digest);
    }

    /**
     * Strict URL-safe Base64 without padding: the body must be exactly what
     * {@link #toToken()} writes, so whitespace, padding, the standard alphabet
     * and dangling bits are all rejected.
     */
    private static byte[] decodeBody(String body) {
        byte[] bytes;
        try {
            bytes = STRICT_URL_SAFE.decode(body);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("bad ciphertext encoding in envelope: " + body, e);
        }
        if (!Base64.encodeBase64URLSafeString(bytes).equals(body)) {
            throw new IllegalArgumentException("bad ciphertext encoding in envelope: " + body);
        }
        return bytes;
    }

    public String toToken() {
        return Base64.encodeBase64URLSafeString(ciphertext.getBytes(StandardCharsets.UTF_8))
                + SEP + metadata + SEP + plainDigest;
    }

    /** True when {@code decoded} hashes to the digest recorded at seal time. */
    public boolean matches(String decoded) {
        return decoded != null && plainDigest.equals(digest(decoded));
    }

    public String getCiphertext() { return ciphertext; }

    public String getMetadata() { return metadata; }

    public String getPlainDigest() { return plainDigest; }

    static String digest(String plain) {
        return DigestUtils.sha256Hex(plain.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CipherEnvelope)) return false;
        CipherEnvelope that = (CipherEnvelope) o;
        return ciphertext.equals(that.ciphertext)
                && metadata.equals(that.metadata)
                && plainDigest.equals(that.plainDigest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ciphertext, metadata, plainDigest);
    }
}
