package com.openforge.streamfold.config;

import com.openforge.streamfold.document.LoaderProperties;
import com.openforge.streamfold.llm.LlmProperties;
import com.openforge.streamfold.llm.LlmRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reports:
 *   - LLM providers: primary + fallback config (API key is masked), router status
 *   - Document loader: store address and collection, or disabled
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties           llmProperties;
    private final LoaderProperties        loaderProperties;
    private final ObjectProvider<LlmRouter> llmRouter;
    private final Environment             env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Streamfold  ·  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Token stream   : ws://…:{}/ws  → /topic/stream/<runId>
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Router         : {}
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Document Loader                                         ║
                ║    {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,
                port,

                llmRouter.getIfAvailable() != null ? "✔ ready" : "✘ disabled",
                describe(llmProperties.primary()),
                describe(llmProperties.fallback()),

                describeLoader(loaderProperties)
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String describe(LlmProperties.ProviderConfig provider) {
        if (provider == null || provider.baseUrl() == null || provider.baseUrl().isBlank()) {
            return "(not configured)";
        }
        return provider.name() + "  [" + provider.model() + "]  key=" + maskKey(provider.apiKey());
    }

    static String describeLoader(LoaderProperties loader) {
        if (!loader.enabled()) {
            return "✘ disabled";
        }
        return "✔ " + loader.connectionString() + "  db=" + loader.databaseName()
                + "  collection=" + loader.collectionName();
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is absent.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
