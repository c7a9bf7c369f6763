package com.alertgate.service;

import com.alertgate.core.config.GateConfig;
import com.alertgate.core.config.GateConfigLoader;
import com.alertgate.core.model.AlertEvent;
import com.alertgate.core.pipeline.AdmissionPipeline;
import com.alertgate.core.pipeline.AdmissionResult;
import com.alertgate.core.pipeline.EventPublisher;
import com.alertgate.core.quiet.QueueManagerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the standalone alert gate.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   stdin (one JSON event per line)
 *     → decode → AlertEvent
 *     → AdmissionPipeline (storm, throttle, quiet hours)
 *     → ChannelNotifier (per-channel dispatch or quiet-hours queue)
 *     → LoggingEventPublisher
 * </pre>
 *
 * <h3>Background work</h3>
 * <p>
 * A single scheduler thread flushes digests and publishes throttle
 * summaries at the intervals given by {@link ServiceConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertGateService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertGateService.class);

    private final ServiceConfig config;
    private final AdmissionPipeline pipeline;
    private final ChannelNotifier notifier;
    private final DigestScheduler digestScheduler;
    private final ThrottleSummaryReporter summaryReporter;
    private final HealthServer healthServer;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AlertGateService(ServiceConfig config, GateConfig gateConfig, EventPublisher sink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(gateConfig, "gateConfig must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        this.notifier = new ChannelNotifier(sink, QueueManagerSettings.builder()
                .clock(clock)
                .quietHours(gateConfig.getQuietHours())
                .maxQueueSize(config.getQueueMaxSize())
                .checkInterval(Duration.ofSeconds(config.getQueueCheckIntervalSeconds())));
        this.pipeline = new AdmissionPipeline(gateConfig, clock);
        this.pipeline.setEventPublisher(notifier);
        this.digestScheduler = new DigestScheduler(pipeline, notifier);
        this.summaryReporter = new ThrottleSummaryReporter(pipeline.getThrottleManager(), notifier);
        this.healthServer = new HealthServer(pipeline, notifier::queuedCounts);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gate-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting alert gate with config: {}", config);

        // 2. Load rules, storm and quiet-hours settings
        GateConfig gateConfig = loadGateConfig(config);
        if (gateConfig.getRules().isEmpty()) {
            LOG.warn("No alert rules defined; every event will be ignored");
        }
        LOG.info("Loaded {} alert rule(s)", gateConfig.getRules().size());

        // 3. Wire and start
        AlertGateService service = new AlertGateService(
                config, gateConfig, new LoggingEventPublisher(), Clock.systemUTC());
        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "gate-shutdown"));
        service.start();

        // 4. Consume events until stdin closes
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            long processed = service.ingest(in);
            LOG.info("Input closed after {} event(s)", processed);
        } finally {
            service.close();
        }
    }

    /**
     * Start the health server and the background schedules.
     *
     * @throws IOException if the health port cannot be bound
     */
    public void start() throws IOException {
        healthServer.start(config.getHealthPort());
        scheduler.scheduleWithFixedDelay(digestScheduler,
                config.getDigestIntervalSeconds(), config.getDigestIntervalSeconds(), TimeUnit.SECONDS);
        scheduler.scheduleWithFixedDelay(summaryReporter,
                config.getSummaryIntervalSeconds(), config.getSummaryIntervalSeconds(), TimeUnit.SECONDS);
    }

    /**
     * Run every line of {@code in} through the pipeline. Lines that do not
     * decode are logged and skipped.
     *
     * @return number of events processed
     */
    public long ingest(BufferedReader in) throws IOException {
        long processed = 0;
        String line;
        while ((line = in.readLine()) != null) {
            AlertEvent event = EventJson.decode(line);
            if (event == null) {
                continue;
            }
            List<AdmissionResult> results = pipeline.process(event);
            LOG.debug("Event {} evaluated against {} rule(s): {}", event.getEventType(), results.size(), results);
            processed++;
        }
        return processed;
    }

    /**
     * Stop the schedules, publish a final throttle summary, flush the
     * channel queues and stop the health server. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        summaryReporter.run();
        notifier.close();
        healthServer.stop();
        LOG.info("Alert gate stopped");
    }

    AdmissionPipeline pipeline() {
        return pipeline;
    }

    ChannelNotifier notifier() {
        return notifier;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static GateConfig loadGateConfig(ServiceConfig config) {
        String path = config.getConfigPath();
        if (path != null && !path.isBlank()) {
            return GateConfigLoader.fromFile(path);
        }
        return GateConfigLoader.load();
    }
}
