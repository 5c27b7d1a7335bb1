package com.example.docredact.crypto;

import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Issues one-time session keys and converts them to and from their transport form.
 * Keys are 256-bit AES keys; the transport form is URL-safe Base64 (44 characters, padded).
 */
@Component
public class KeyManager {

    public static final int KEY_LENGTH_BYTES = 32;
    private static final String KEY_ALGORITHM = "AES";

    private final SecureRandom random = new SecureRandom();

    public SecretKey generate() {
        byte[] raw = new byte[KEY_LENGTH_BYTES];
        random.nextBytes(raw);
        return new SecretKeySpec(raw, KEY_ALGORITHM);
    }

    public String encode(SecretKey key) {
        return Base64.getUrlEncoder().encodeToString(key.getEncoded());
    }

    public SecretKey decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new InvalidKeyFormatException("Decryption key is missing");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyFormatException("Decryption key is not valid URL-safe Base64", e);
        }
        if (raw.length != KEY_LENGTH_BYTES) {
            throw new InvalidKeyFormatException("Decryption key must decode to " + KEY_LENGTH_BYTES + " bytes");
        }
        return new SecretKeySpec(raw, KEY_ALGORITHM);
    }
}
