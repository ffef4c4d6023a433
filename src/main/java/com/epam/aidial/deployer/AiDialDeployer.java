package com.epam.aidial.deployer;

import com.epam.aidial.deployer.advisor.HttpRemediationAdvisor;
import com.epam.aidial.deployer.advisor.RemediationAdvisor;
import com.epam.aidial.deployer.config.Storage;
import com.epam.aidial.deployer.executor.ControllerDeploymentExecutor;
import com.epam.aidial.deployer.executor.DeploymentExecutor;
import com.epam.aidial.deployer.service.ArtifactStore;
import com.epam.aidial.deployer.service.DeploymentOrchestrator;
import com.epam.aidial.deployer.service.DeploymentStore;
import com.epam.aidial.deployer.service.ExecutionRegistry;
import com.epam.aidial.deployer.service.HeartbeatService;
import com.epam.aidial.deployer.service.LockService;
import com.epam.aidial.deployer.service.ProgressBroadcaster;
import com.epam.aidial.deployer.storage.BlobStorage;
import com.epam.deltix.gflog.core.LogConfigurator;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Clock;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import io.vertx.config.spi.utils.JsonObjectHelper;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.core.metrics.MetricsOptions;
import io.vertx.micrometer.MicrometerMetricsOptions;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

@Slf4j
@Setter
@Getter
public class AiDialDeployer {

    private JsonObject settings;
    private Vertx vertx;
    private HttpServer server;
    private HttpClient client;

    private BlobStorage storage;
    private DeploymentExecutor executor;
    private RemediationAdvisor advisor;

    private HeartbeatService heartbeatService;
    private DeploymentStore deploymentStore;
    private ArtifactStore artifactStore;
    private DeploymentOrchestrator orchestrator;
    private DeployerApi api;

    private LongSupplier clock = System::currentTimeMillis;
    private Supplier<String> generator = () -> UUID.randomUUID().toString().replace("-", "");

    @VisibleForTesting
    void start() throws Exception {
        try {
            settings = (settings == null) ? settings() : settings;
            VertxOptions vertxOptions = new VertxOptions(settings("vertx"));
            setupMetrics(vertxOptions);

            vertx = Vertx.vertx(vertxOptions);
            client = vertx.createHttpClient(new HttpClientOptions(settings("client")));

            if (storage == null) {
                Storage storageConfig = Json.decodeValue(settings("storage").toBuffer(), Storage.class);
                storage = new BlobStorage(storageConfig);
            }

            if (executor == null) {
                executor = new ControllerDeploymentExecutor(client, settings("executor"));
            }

            if (advisor == null) {
                advisor = new HttpRemediationAdvisor(client, settings("advisor"));
            }

            LockService lockService = new LockService();
            ExecutionRegistry registry = new ExecutionRegistry();
            heartbeatService = new HeartbeatService(vertx, settings("progress").getLong("heartbeatPeriod", 15_000L));
            ProgressBroadcaster broadcaster = new ProgressBroadcaster(heartbeatService, settings("progress"));

            deploymentStore = new DeploymentStore(storage, lockService);
            artifactStore = new ArtifactStore(storage, lockService, settings("artifacts"), clock);
            orchestrator = new DeploymentOrchestrator(vertx, deploymentStore, artifactStore, executor, advisor,
                    broadcaster, registry, settings, clock, generator);
            orchestrator.recover();

            api = new DeployerApi(vertx, orchestrator, artifactStore, broadcaster, version());

            server = vertx.createHttpServer(new HttpServerOptions(settings("server"))).requestHandler(api);
            open(server, HttpServer::listen);

            log.info("Deployer started on {}", server.actualPort());
        } catch (Throwable e) {
            log.error("Deployer failed to start:", e);
            stop();
            throw e;
        }
    }

    @VisibleForTesting
    void stop() {
        try {
            close(server, HttpServer::close);
            close(orchestrator);
            close(heartbeatService);
            close(client, HttpClient::close);
            close(vertx, Vertx::close);
            close(storage);
            log.info("Deployer stopped");
            LogConfigurator.unconfigure();
        } catch (Throwable e) {
            log.warn("Deployer failed to stop:", e);
            LogConfigurator.unconfigure();
            System.exit(-1);
        }
    }

    public static JsonObject settings() throws Exception {
        return defaultSettings()
                .mergeIn(fileSettings(), true)
                .mergeIn(envSettings(), true);
    }

    private JsonObject settings(String key) {
        return settings.getJsonObject(key, new JsonObject());
    }

    private static JsonObject defaultSettings() throws IOException {
        String file = "aidial.deployer.settings.json";

        try (InputStream stream = AiDialDeployer.class.getClassLoader().getResourceAsStream(file)) {
            Objects.requireNonNull(stream, "Default resource file with settings is not found");
            String json = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return new JsonObject(json);
        }
    }

    private static String version() {
        String filename = "version";
        String version = "undefined";

        try (InputStream stream = AiDialDeployer.class.getClassLoader().getResourceAsStream(filename)) {
            Objects.requireNonNull(stream, "Version file not found");
            version = new String(stream.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (Exception e) {
            log.warn("Failed to load version", e);
        }
        return version;
    }

    private static JsonObject fileSettings() throws IOException {
        String file = System.getenv().get("AIDIAL_DEPLOYER_SETTINGS");
        if (file == null) {
            return new JsonObject();
        }

        try (InputStream stream = new FileInputStream(file)) {
            String json = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return new JsonObject(json);
        }
    }

    private static JsonObject envSettings() {
        String prefix = "aidial.deployer.";
        Properties properties = new Properties();

        for (Map.Entry<String, String> entry : System.getenv().entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(prefix)) {
                properties.put(key.substring(prefix.length()), entry.getValue());
            }
        }

        return JsonObjectHelper.from(properties, false, true);
    }

    private static <R> void open(R resource, AsyncOpener<R> opener) throws Exception {
        CompletableFuture<R> startup = new CompletableFuture<>();
        opener.open(resource).onSuccess(startup::complete).onFailure(startup::completeExceptionally);
        startup.get(15, TimeUnit.SECONDS);
    }

    private static <R> void close(R resource, AsyncCloser<R> closer) throws Exception {
        if (resource != null) {
            CompletableFuture<Void> shutdown = new CompletableFuture<>();
            closer.close(resource).onSuccess(shutdown::complete).onFailure(shutdown::completeExceptionally);
            shutdown.get(15, TimeUnit.SECONDS);
        }
    }

    private static void close(AutoCloseable resource) throws Exception {
        if (resource != null) {
            resource.close();
        }
    }

    private interface AsyncOpener<R> {
        Future<R> open(R resource);
    }

    private interface AsyncCloser<R> {
        Future<Void> close(R resource);
    }

    public static void main(String[] args) throws Exception {
        AiDialDeployer deployer = new AiDialDeployer();
        try {
            deployer.start();
        } catch (Throwable e) {
            System.exit(-1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(deployer::stop, "shutdown-hook"));
    }

    private static void setupMetrics(VertxOptions options) {
        MetricsOptions metrics = options.getMetricsOptions();
        if (metrics == null || !metrics.isEnabled()) {
            return;
        }

        JsonObject oltp = metrics.toJson().getJsonObject("oltpOptions", new JsonObject());
        if (oltp == null || !oltp.getBoolean("enabled", false)) {
            return;
        }

        MicrometerMetricsOptions micrometer = new MicrometerMetricsOptions(metrics.toJson());
        micrometer.setMicrometerRegistry(new OtlpMeterRegistry(oltp::getString, Clock.SYSTEM));

        options.setMetricsOptions(micrometer);
    }
}
