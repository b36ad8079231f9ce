package com.openforge.ariste.config;

import com.openforge.ariste.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is ready.
 *
 * Reported:
 *   - Server: port and Java version
 *   - Chat endpoint: provider, URL, model and request flags
 *   - Agent: decoding mode, subagent pool size, working directory
 *   - Tools: registered names in model order
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final AgentProperties properties;
    private final ToolRegistry    toolRegistry;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Ariste  —  Startup Summary                  ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Chat Endpoint                                           ║
                ║    Provider       : {}
                ║    URL            : {}
                ║    Model          : {}
                ║    Flags          : stream={} think={} verbose={} timeout={}s
                ╠══════════════════════════════════════════════════════════╣
                ║  Agent                                                   ║
                ║    Decoding Mode  : {}
                ║    Subagent Pool  : {}
                ║    Working Dir    : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                properties.provider(),
                properties.chatUrl(),
                properties.modelOrDefault(),
                properties.stream(), properties.think(), properties.verbose(), properties.timeoutSeconds(),

                properties.decodingMode(),
                properties.subagentPoolSize(),
                properties.workingDirectory(),

                String.join(", ", toolRegistry.names())
        );
    }
}
