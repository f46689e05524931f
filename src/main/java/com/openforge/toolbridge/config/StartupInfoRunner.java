package com.openforge.toolbridge.config;

import com.openforge.toolbridge.adapter.JsonPlaceholderProperties;
import com.openforge.toolbridge.agent.AgentProperties;
import com.openforge.toolbridge.llm.LlmProperties;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is ready:
 * server, model backend (API key masked), adapter backend, tool catalogue, limits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties             llmProperties;
    private final JsonPlaceholderProperties adapterProperties;
    private final AgentProperties           agentProperties;
    private final ToolRegistry              toolRegistry;
    private final Environment               env;

    @Override
    public void run(ApplicationArguments args) {
        String tools = toolRegistry.catalogue().stream()
                .map(ToolSpec::name)
                .collect(Collectors.joining(", "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Toolbridge  -  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Model backend                                           ║
                ║    Provider       : {}  [{}]  key={}
                ║    Endpoint       : {}  timeout={}s
                ╠══════════════════════════════════════════════════════════╣
                ║  Adapters                                                ║
                ║    Base URL       : {}  timeout={}s
                ║    Tools          : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Turns                                                   ║
                ║    Workers        : {}  timeout={}s  idle-evict={}min
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                llmProperties.name(),
                llmProperties.model(),
                maskKey(llmProperties.apiKey()),
                llmProperties.baseUrl(),
                llmProperties.timeoutSeconds(),

                adapterProperties.baseUrl(),
                adapterProperties.timeoutSeconds(),
                tools,

                agentProperties.turnWorkers(),
                agentProperties.turnTimeoutSeconds(),
                agentProperties.session().idleTimeoutMinutes()
        );
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" for blank keys.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
