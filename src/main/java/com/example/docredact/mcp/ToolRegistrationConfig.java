package com.example.docredact.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the session and capability tools over the MCP server endpoint.
 */
@Configuration
public class ToolRegistrationConfig {

    @Bean
    public ToolCallbackProvider redactionToolCallbacks(SessionTools sessionTools, CapabilitiesTools capabilitiesTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools, capabilitiesTools)
                .build();
    }
}
