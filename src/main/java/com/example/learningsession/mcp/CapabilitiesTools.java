package com.example.learningsession.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available tool names for introspection")
    public Map<String,Object> capabilities_list() {
        // static, to keep this bean free of the other tool beans
        return Map.of(
                "server", Map.of("name", "learning-session-coordinator", "version", "0.1.0"),
                "tools", List.of("bridge_stats", "session_context", "verify_cache_sync",
                        "verify_course_cache", "force_cache_repair", "capabilities_list"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false
                )
        );
    }
}
