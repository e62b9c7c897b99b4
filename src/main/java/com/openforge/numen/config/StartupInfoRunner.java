package com.openforge.numen.config;

import com.openforge.numen.llm.LlmProperties;
import com.openforge.numen.memory.EmbeddingProperties;
import com.openforge.numen.memory.MilvusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary once the context is ready.
 *
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Vector index: Milvus address when enabled, otherwise the relational store
 *   - Providers: completion primary/fallback and embedding (API keys masked)
 *   - Runtime: retrieval defaults and worker pool size
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final LlmProperties       llmProperties;
    private final EmbeddingProperties embeddingProperties;
    private final MilvusProperties    milvusProperties;
    private final RuntimeProperties   runtimeProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Numen Runtime  -  Startup Summary           ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Worker Threads : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory Index                                            ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Completion Providers                                    ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Retrieval Defaults                                      ║
                ║    memory-k={}  thread-window={}  user-memory-k={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                env.getProperty("agent.runtime.worker-threads", "16"),

                probeDatabase(),

                milvusProperties.enabled()
                        ? "Milvus %s:%d  collection=%s  dim=%d".formatted(milvusProperties.host(),
                                milvusProperties.port(), milvusProperties.collectionName(),
                                milvusProperties.vectorDimensions())
                        : "Relational store (in-process cosine)",

                describe(primary),
                describe(fallback),

                embeddingProperties.model(),
                embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(),
                maskKey(embeddingProperties.apiKey()),

                runtimeProperties.memoryK(),
                runtimeProperties.threadWindow(),
                runtimeProperties.userMemoryK()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    private static String describe(LlmProperties.ProviderConfig config) {
        if (config == null || !config.isConfigured()) return "(not configured)";
        return "%s  [%s]  key=%s".formatted(config.name(), config.model(), maskKey(config.apiKey()));
    }

    /** First 6 + "..." + last 4 characters; "(not set)" for blanks and placeholders. */
    private static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
