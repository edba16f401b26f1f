package com.example.sourcesync.common.util;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-GCM for stored source credentials. Output layout: base64(iv || ciphertext+tag).
 */
public final class AesCryptoUtil {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH_BIT = 128;
    private static final int GCM_IV_LENGTH_BYTE = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AesCryptoUtil() {
    }

    public static String encrypt(String plainText, String key) {
        byte[] iv = new byte[GCM_IV_LENGTH_BYTE];
        RANDOM.nextBytes(iv);
        try {
            byte[] encrypted = newCipher(Cipher.ENCRYPT_MODE, key, iv)
                    .doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            byte[] combined = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    public static String decrypt(String cipherText, String key) {
        byte[] combined = Base64.getDecoder().decode(cipherText);
        if (combined.length <= GCM_IV_LENGTH_BYTE) {
            throw new IllegalArgumentException("Malformed cipher text");
        }
        byte[] iv = new byte[GCM_IV_LENGTH_BYTE];
        System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH_BYTE);
        try {
            byte[] plain = newCipher(Cipher.DECRYPT_MODE, key, iv)
                    .doFinal(combined, GCM_IV_LENGTH_BYTE, combined.length - GCM_IV_LENGTH_BYTE);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential decryption failed", e);
        }
    }

    private static Cipher newCipher(int mode, String key, byte[] iv) throws GeneralSecurityException {
        int keyLen = key == null ? 0 : key.length();
        if (keyLen != 16 && keyLen != 24 && keyLen != 32) {
            throw new IllegalArgumentException("AES key length must be 16/24/32");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode,
                new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "AES"),
                new GCMParameterSpec(GCM_TAG_LENGTH_BIT, iv));
        return cipher;
    }
}
