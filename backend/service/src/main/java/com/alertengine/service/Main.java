package com.alertengine.service;

import com.alertengine.core.bus.EventBus;
import com.alertengine.engine.AlertEngine;
import com.alertengine.engine.EngineContext;
import com.alertengine.engine.api.ActionAugmenter;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.config.EngineSettings;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.service.ai.ChatCompletionActionAugmenter;
import com.alertengine.service.api.ApiServer;
import com.alertengine.service.api.DiagnosticsTracker;
import com.alertengine.service.config.ConfigLoader;
import com.alertengine.service.notify.LoggingNotificationGateway;
import com.alertengine.service.store.JsonFileAlertStore;
import com.alertengine.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String MEMORY_STORE = "memory";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        RuntimeFlags flags = resolveRuntimeFlags(System.getenv(), LOGGER::warning);
        Clock clock = Clock.systemDefaultZone();

        EngineSettings settings = ConfigLoader.loadEngineSettings(flags.configDir());
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(flags.eventLog());
        eventBus.subscribeAll(eventStore::append);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock);

        AlertStore store = MEMORY_STORE.equals(flags.alertStore())
                ? new InMemoryAlertStore()
                : new JsonFileAlertStore(Path.of(flags.alertStore()));
        AlertEngine engine = new AlertEngine(new EngineContext(
                store,
                new LoggingNotificationGateway(clock),
                eventBus,
                clock,
                settings,
                actionAugmenter(flags)
        ));
        ApiServer apiServer = new ApiServer(flags.apiPort(), engine, eventStore, diagnosticsTracker);

        engine.start();
        apiServer.start();
        LOGGER.info("Alert engine started store=" + flags.alertStore() + " port=" + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            engine.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static RuntimeFlags resolveRuntimeFlags(Map<String, String> env, Consumer<String> warn) {
        String portRaw = env.getOrDefault("API_PORT", "8080");
        int apiPort;
        try {
            apiPort = Integer.parseInt(portRaw.trim());
        } catch (NumberFormatException e) {
            warn.accept("Unknown API_PORT=" + portRaw + ", defaulting to 8080");
            apiPort = 8080;
        }

        String alertStore = env.getOrDefault("ALERT_STORE", "state/alerts.json");
        if (alertStore.isBlank()) {
            warn.accept("Blank ALERT_STORE, defaulting to state/alerts.json");
            alertStore = "state/alerts.json";
        }

        String llmApiKey = env.getOrDefault("LLM_API_KEY", "");
        return new RuntimeFlags(
                apiPort,
                alertStore,
                Path.of(env.getOrDefault("CONFIG_DIR", "config")),
                Path.of(env.getOrDefault("EVENT_LOG", "logs/alert-events.jsonl")),
                llmApiKey.isBlank() ? null : llmApiKey,
                env.getOrDefault("LLM_BASE_URL", "https://api.openai.com/v1"),
                env.getOrDefault("LLM_MODEL", "gpt-4o-mini")
        );
    }

    record RuntimeFlags(
            int apiPort,
            String alertStore,
            Path configDir,
            Path eventLog,
            String llmApiKey,
            String llmBaseUrl,
            String llmModel
    ) {
        boolean augmentationEnabled() {
            return llmApiKey != null;
        }
    }

    private static ActionAugmenter actionAugmenter(RuntimeFlags flags) {
        if (!flags.augmentationEnabled()) {
            LOGGER.info("LLM_API_KEY not set; recommended actions come from templates only.");
            return null;
        }
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        return new ChatCompletionActionAugmenter(httpClient, flags.llmBaseUrl(), flags.llmApiKey(), flags.llmModel(),
                Duration.ofSeconds(10));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed loading logging.properties; keeping JVM defaults", e);
        }
    }
}
