package com.example.learningsession.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final CoordinatorTools coordinatorTools;
    private final SyncVerificationTools syncVerificationTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(CoordinatorTools coordinatorTools, SyncVerificationTools syncVerificationTools,
                                  CapabilitiesTools capTools) {
        this.coordinatorTools = coordinatorTools;
        this.syncVerificationTools = syncVerificationTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(coordinatorTools, syncVerificationTools, capTools)
                .build();
    }
}
