package com.example.docredact.engine;

/**
 * A multimodal model that answers a text instruction about one page image.
 */
public interface VisionModelClient {

    /**
     * @return the model's raw text answer
     * @throws RuntimeException when the model is unreachable or rejects the request
     */
    String analyze(byte[] pngImage, String instructions);
}
