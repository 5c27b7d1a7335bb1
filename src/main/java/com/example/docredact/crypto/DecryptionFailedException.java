package com.example.docredact.crypto;

/**
 * Authenticated decryption did not verify. Wrong keys and corrupted ciphertext are reported the same way.
 */
public class DecryptionFailedException extends RuntimeException {

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
