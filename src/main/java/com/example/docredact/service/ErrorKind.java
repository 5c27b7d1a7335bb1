package com.example.docredact.service;

public enum ErrorKind {
    /** Backend could not process the document; retrying or switching engine may help. */
    ENGINE_FAILURE,
    STORE_UNAVAILABLE,
    /** Unknown or expired document id. The two are deliberately indistinguishable. */
    SESSION_NOT_FOUND,
    INVALID_KEY_FORMAT,
    /** Wrong key or corrupted ciphertext. */
    DECRYPTION_FAILED,
    RESTORATION_FAILED,
    INVALID_REQUEST
}
