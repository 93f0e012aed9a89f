package com.lennon.splitshift.mojo;

import com.lennon.splitshift.core.CipherEnvelope;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.SplitShiftService;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class SplitShiftMojoTest {
    private static final Logger log = LoggerFactory.getLogger(SplitShiftMojoTest.class);

    private static <T extends BaseMojo> T configure(T mojo, Integer s1, Integer s2, String text) {
        mojo.shift1 = s1;
        mojo.shift2 = s2;
        mojo.text = text;
        return mojo;
    }

    @Test
    @DisplayName("encrypt then decrypt with metadata through the mojos")
    void encrypt_decrypt_withMetadata() throws Exception {
        EncryptMojo enc = configure(new EncryptMojo(), 3, 2, "Hello, World!");
        enc.execute();
        assertEquals("Ekrrj, Ajmrj!", enc.output);

        DecryptMojo dec = configure(new DecryptMojo(), 3, 2, enc.output);
        dec.metadata = "ulllL00ULLll0";
        dec.execute();
        log.info("[mojo] enc={} dec={}", enc.output, dec.output);
        assertEquals("Hello, World!", dec.output);
    }

    @Test
    void decrypt_withoutMetadata_usesHeuristic() throws Exception {
        DecryptMojo dec = configure(new DecryptMojo(), 3, 2, "Ekrrj, Ajmrj!");
        dec.execute();
        assertEquals("Helld, Ddgld!", dec.output);
    }

    @Test
    void envelope_roundtrip() throws Exception {
        EncryptMojo enc = configure(new EncryptMojo(), -4, 9, "Sealed text, 2 parts.");
        enc.envelope = true;
        enc.execute();

        DecryptMojo dec = configure(new DecryptMojo(), -4, 9, enc.output);
        dec.envelope = true;
        dec.execute();
        assertEquals("Sealed text, 2 parts.", dec.output);
    }

    @Test
    void envelope_wrongKeys_fails() {
        String token = new SplitShiftService().seal("Attack at dawn", ShiftKeys.of(3, 2)).toToken();
        DecryptMojo dec = configure(new DecryptMojo(), 4, 2, token);
        dec.envelope = true;
        assertThrows(MojoFailureException.class, dec::execute);
    }

    @Test
    void envelope_malformed_isExecutionError() {
        DecryptMojo dec = configure(new DecryptMojo(), 3, 2, "not-a-token");
        dec.envelope = true;
        assertThrows(MojoExecutionException.class, dec::execute);
    }

    @Test
    void decrypt_lengthMismatch_isExecutionError() {
        DecryptMojo dec = configure(new DecryptMojo(), 3, 4, "ab");
        dec.metadata = "l";
        MojoExecutionException ex = assertThrows(MojoExecutionException.class, dec::execute);
        assertTrue(ex.getMessage().contains("do not match"));
        assertNull(dec.output);
    }

    @Test
    void verify_succeeds() throws Exception {
        VerifyMojo v = configure(new VerifyMojo(), Integer.MAX_VALUE, Integer.MIN_VALUE, "Any Text 123 éß");
        v.execute();
    }

    @Test
    void missingText_isNoop() throws Exception {
        EncryptMojo enc = configure(new EncryptMojo(), 3, 2, null);
        enc.execute();
        assertNull(enc.output);
        DecryptMojo dec = configure(new DecryptMojo(), 3, 2, "");
        dec.execute();
        assertNull(dec.output);
    }

    @Test
    void onlyOneShift_isExecutionError() {
        EncryptMojo enc = configure(new EncryptMojo(), 3, null, "abc");
        assertThrows(MojoExecutionException.class, enc::execute);
    }

    @Test
    void missingKeys_isExecutionError() {
        Assumptions.assumeTrue(System.getenv(BaseMojo.KEYS_ENV) == null,
                BaseMojo.KEYS_ENV + " is set, skipping");
        EncryptMojo enc = configure(new EncryptMojo(), null, null, "abc");
        assertThrows(MojoExecutionException.class, enc::execute);
    }

    @Test
    void envelopeOutput_parses() throws Exception {
        EncryptMojo enc = configure(new EncryptMojo(), 3, 2, "abc");
        enc.envelope = true;
        enc.execute();
        CipherEnvelope env = CipherEnvelope.parse(enc.output);
        assertEquals("lll", env.getMetadata());
        assertTrue(env.matches("abc"));
    }
}
