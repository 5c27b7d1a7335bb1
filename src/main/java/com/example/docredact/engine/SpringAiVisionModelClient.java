package com.example.docredact.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

@Component
public class SpringAiVisionModelClient implements VisionModelClient {

    private static final Logger logger = LoggerFactory.getLogger(SpringAiVisionModelClient.class);

    private final ChatClient chatClient;

    public SpringAiVisionModelClient(ObjectProvider<ChatClient.Builder> builderProvider) {
        ChatClient.Builder builder = builderProvider.getIfAvailable();
        this.chatClient = builder != null ? builder.build() : null;
        if (chatClient == null) {
            logger.warn("No chat model configured; the vision engine will reject requests");
        }
    }

    @Override
    public String analyze(byte[] pngImage, String instructions) {
        if (chatClient == null) {
            throw new IllegalStateException("No vision model is configured");
        }
        return chatClient.prompt()
                .user(u -> u.text(instructions).media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(pngImage)))
                .call()
                .content();
    }
}
