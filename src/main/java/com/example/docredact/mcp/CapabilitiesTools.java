package com.example.docredact.mcp;

import com.example.docredact.engine.EngineGateway;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    private final EngineGateway engineGateway;
    private final long ttlSeconds;

    public CapabilitiesTools(EngineGateway engineGateway,
                             @Value("${app.redaction.ttl-seconds:86400}") long ttlSeconds) {
        this.engineGateway = engineGateway;
        this.ttlSeconds = ttlSeconds;
    }

    @Tool(description = "Describe the redaction service: engines, severity range, session lifetime and endpoints")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "doc-redact", "version", "0.1.0"),
                "engines", engineGateway.variants().stream().map(Enum::name).sorted().toList(),
                "severity", Map.of("min", EngineGateway.MIN_SEVERITY, "max", EngineGateway.MAX_SEVERITY),
                "sessionTtlSec", ttlSeconds,
                "inputFormats", List.of("application/pdf"),
                "endpoints", List.of("/redact-llm/", "/redact-classic/", "/decrypt/", "/unredact/"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false
                )
        );
    }
}
