package com.example.docredact.engine;

public enum EngineVariant {
    /** Multimodal model reads rendered pages. Slower, relies on a remote model. */
    VISION,
    /** Local regex detection over the PDF text layer. */
    RULE_BASED
}
