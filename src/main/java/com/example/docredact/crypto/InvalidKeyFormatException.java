package com.example.docredact.crypto;

public class InvalidKeyFormatException extends RuntimeException {

    public InvalidKeyFormatException(String message) {
        super(message);
    }

    public InvalidKeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
