package com.alertwarden.core.engine;

import com.alertwarden.core.config.ConfigDocument;
import com.alertwarden.core.config.ConfigException;
import com.alertwarden.core.config.ConfigValidator;
import com.alertwarden.core.config.EngineConfig;
import com.alertwarden.core.dispatch.DeliveryChannel;
import com.alertwarden.core.dispatch.DispatchErrorListener;
import com.alertwarden.core.dispatch.NotificationDispatcher;
import com.alertwarden.core.evaluation.ConditionEvaluator;
import com.alertwarden.core.evaluation.Evaluation;
import com.alertwarden.core.evaluation.RuleHealth;
import com.alertwarden.core.evaluation.RuleHealthTracker;
import com.alertwarden.core.evaluation.TelemetrySource;
import com.alertwarden.core.metrics.EngineMetrics;
import com.alertwarden.core.model.AlertEvent;
import com.alertwarden.core.model.AlertInstance;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.NotificationAttempt;
import com.alertwarden.core.registry.ActionGroupRegistry;
import com.alertwarden.core.registry.RoutingTable;
import com.alertwarden.core.registry.ValidationException;
import com.alertwarden.core.scheduling.RuleScheduler;
import com.alertwarden.core.state.AlertStateMachine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * The alerting engine.
 *
 * <p>
 * Wires the components together:
 * </p>
 * <pre>
 *   RuleScheduler -&gt; ConditionEvaluator -&gt; AlertStateMachine
 *                 -&gt; NotificationDispatcher -&gt; DeliveryChannel
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * {@link #loadConfig(ConfigDocument)} validates the whole document before
 * touching anything and activates it in one step, or rejects it with a
 * {@link ConfigException} and leaves the running configuration untouched.
 * Calling it again with a new document is a hot reload: rules that survive
 * keep their alert state.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} begins ticking the scheduler and the retry pump.
 * {@link #shutdown()} stops new work; evaluations and deliveries in flight
 * are allowed to finish and are never interrupted.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingEngine.class);

    private final EngineSettings settings;
    private final Clock clock;
    private final EngineMetrics metrics;
    private final ActionGroupRegistry registry = new ActionGroupRegistry();
    private final ConditionEvaluator evaluator;
    private final RuleHealthTracker health;
    private final AlertStateMachine stateMachine;
    private final RuleScheduler scheduler;
    private final NotificationDispatcher dispatcher;

    /** Executors created here and therefore shut down here. */
    private final List<ExecutorService> ownedExecutors = new ArrayList<>();

    private final Object configLock = new Object();
    private final AtomicLong configVersion = new AtomicLong();
    private volatile EngineConfig config = EngineConfig.empty();

    private ScheduledExecutorService ticker;
    private volatile boolean running;

    private AlertingEngine(Builder b) {
        Objects.requireNonNull(b.telemetrySource, "TelemetrySource must not be null");
        Objects.requireNonNull(b.deliveryChannel, "DeliveryChannel must not be null");
        this.settings = b.settings != null ? b.settings : EngineSettings.defaults();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.metrics = new EngineMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());

        Executor workers = b.workerExecutor != null ? b.workerExecutor
                : own(Executors.newFixedThreadPool(settings.getWorkerThreads(), threads("warden-worker-%d")));
        Executor deliveries = b.deliveryExecutor != null ? b.deliveryExecutor
                : own(new ThreadPoolExecutor(settings.getWorkerThreads(), settings.getWorkerThreads(),
                        60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                        threads("warden-delivery-%d")));
        Executor calls = b.callExecutor != null ? b.callExecutor
                : own(Executors.newCachedThreadPool(threads("warden-call-%d")));

        this.evaluator = new ConditionEvaluator(b.telemetrySource, settings.getTelemetryTimeout(), calls, clock);
        this.health = new RuleHealthTracker(settings.getDegradedThreshold());
        this.stateMachine = new AlertStateMachine(clock,
                b.correlationIds != null ? b.correlationIds : () -> UUID.randomUUID().toString(),
                settings.getReNotifyInterval().orElse(null),
                settings.getMissingDataPolicy());
        this.scheduler = new RuleScheduler(workers, clock, settings.getJitterRatio(),
                b.random != null ? b.random : new Random(), this::runRule, metrics);
        this.dispatcher = NotificationDispatcher.builder()
                .registry(registry)
                .channel(b.deliveryChannel)
                .deliveryExecutor(deliveries)
                .callExecutor(calls)
                .clock(clock)
                .retryPolicy(settings.retryPolicy())
                .deliveryTimeout(settings.getDispatchTimeout())
                .retention(settings.getAttemptRetention())
                .metrics(metrics)
                .errorListener(b.errorListener)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Validate and activate a configuration document.
     *
     * @param document parsed document
     * @return the activated configuration version
     * @throws ConfigException if the document is invalid; nothing is activated
     */
    public long loadConfig(ConfigDocument document) {
        return loadConfig(ConfigValidator.validate(document));
    }

    /**
     * Activate an already validated configuration.
     *
     * @param next configuration to activate
     * @return the activated configuration version
     * @throws ConfigException if the action groups are rejected by the
     *                         registry; nothing is activated
     */
    public long loadConfig(EngineConfig next) {
        Objects.requireNonNull(next, "EngineConfig must not be null");
        synchronized (configLock) {
            try {
                registry.replaceAll(next.getActionGroups(), next.getSeverityEscalations());
            } catch (ValidationException e) {
                throw new ConfigException(e.getProblems());
            }
            dispatcher.updateSeverityLabels(next.getSeverityLevels());

            Set<String> removed = new HashSet<>(config.ruleIds());
            removed.removeAll(next.ruleIds());
            for (String ruleId : removed) {
                scheduler.unschedule(ruleId);
                stateMachine.retire(ruleId);
                health.forget(ruleId);
            }
            for (AlertRule rule : next.getRules()) {
                stateMachine.register(rule.getId());
                scheduler.schedule(rule);
            }

            config = next;
            long version = configVersion.incrementAndGet();
            LOG.info("Configuration version {} active: {} rule(s), {} action group(s), {} removed",
                    version, next.getRules().size(), next.getActionGroups().size(), removed.size());
            return version;
        }
    }

    public long configVersion() {
        return configVersion.get();
    }

    public EngineConfig activeConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Queries and commands
    // ---------------------------------------------------------------

    /**
     * @throws UnknownRuleException if the rule is not loaded
     */
    public AlertInstance getAlertInstance(String ruleId) {
        requireRule(ruleId);
        return stateMachine.current(ruleId).orElseThrow(() -> new UnknownRuleException(ruleId));
    }

    /**
     * Resolve a Firing rule on external acknowledgment. A rule that is not
     * Firing is left as is.
     *
     * @return the resolution event, if a transition happened
     * @throws UnknownRuleException if the rule is not loaded
     */
    public Optional<AlertEvent> manualResolve(String ruleId) {
        Optional<AlertEvent> event = stateMachine.manualResolve(requireRule(ruleId));
        event.ifPresent(e -> publish(e, registry.snapshot()));
        return event;
    }

    public List<AlertInstance> listFiring() {
        return stateMachine.firing();
    }

    /**
     * @return health of the rules currently in MonitoringDegraded
     */
    public List<RuleHealth> listDegraded() {
        return health.degraded(config.ruleIds());
    }

    public Optional<RuleHealth> ruleHealth(String ruleId) {
        return health.health(ruleId);
    }

    /**
     * @return superseded instances of the rule, oldest first; also available
     *         for rules no longer loaded
     */
    public List<AlertInstance> history(String ruleId) {
        return stateMachine.history(ruleId);
    }

    public List<NotificationAttempt> notificationAttempts(String correlationId) {
        return dispatcher.attemptsFor(correlationId);
    }

    public List<NotificationAttempt> givenUpNotifications() {
        return dispatcher.givenUpAttempts();
    }

    /**
     * Evaluate a rule immediately, outside its schedule.
     *
     * @return the lifecycle event the evaluation produced, if any
     * @throws UnknownRuleException if the rule is not loaded
     */
    public Optional<AlertEvent> evaluateNow(String ruleId) {
        return runRule(requireRule(ruleId));
    }

    /**
     * One scheduler pass: submit due rules, then retry due notifications.
     */
    public void tick() {
        try {
            scheduler.tick();
            dispatcher.processDue();
        } catch (RuntimeException e) {
            LOG.error("Engine tick failed", e);
        }
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public boolean isRunning() {
        return running;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (running) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(threads("warden-ticker-%d"));
        long interval = settings.getTickInterval().toMillis();
        ticker.scheduleWithFixedDelay(this::tick, 0, interval, TimeUnit.MILLISECONDS);
        running = true;
        LOG.info("Alerting engine started (tick {} ms, {} rule(s))", interval, config.getRules().size());
    }

    /**
     * Stop scheduling and wait for in-flight work to finish, up to the
     * dispatch timeout.
     */
    public synchronized void shutdown() {
        running = false;
        scheduler.stop();
        if (ticker != null) {
            ticker.shutdown();
        }
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
        }
        Duration grace = settings.getDispatchTimeout();
        for (ExecutorService executor : ownedExecutors) {
            try {
                if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Executor did not finish within {} ms; in-flight work abandoned", grace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Alerting engine stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<AlertEvent> runRule(AlertRule rule) {
        if (!rule.isEnabled()) {
            LOG.trace("Rule [{}] disabled; not evaluated", rule.getId());
            return Optional.empty();
        }
        // a reload during the query must not reroute this evaluation's notices
        RoutingTable routing = registry.snapshot();
        long start = System.nanoTime();
        Evaluation evaluation = evaluator.evaluate(rule);
        metrics.recordEvaluation(evaluation.getOutcome(), Duration.ofNanos(System.nanoTime() - start));
        if (health.record(evaluation)) {
            metrics.recordDegraded();
        }

        Optional<AlertEvent> event = stateMachine.apply(rule, evaluation);
        event.ifPresent(e -> publish(e, routing));
        return event;
    }

    private void publish(AlertEvent event, RoutingTable routing) {
        metrics.recordTransition(event.getType());
        try {
            dispatcher.dispatch(event, routing);
        } catch (RuntimeException e) {
            // delivery is best-effort; the transition already happened
            LOG.error("Failed to dispatch {} for rule [{}]", event.getType(), event.getRuleId(), e);
        }
    }

    private AlertRule requireRule(String ruleId) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        return config.rule(ruleId).orElseThrow(() -> new UnknownRuleException(ruleId));
    }

    private <E extends ExecutorService> E own(E executor) {
        ownedExecutors.add(executor);
        return executor;
    }

    private static ThreadFactory threads(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link AlertingEngine}. Only the two collaborators are
     * required; executors left unset are created by the engine and shut down
     * with it.
     */
    public static class Builder {
        private TelemetrySource telemetrySource;
        private DeliveryChannel deliveryChannel;
        private EngineSettings settings;
        private Clock clock;
        private Executor workerExecutor;
        private Executor deliveryExecutor;
        private Executor callExecutor;
        private MeterRegistry meterRegistry;
        private Supplier<String> correlationIds;
        private Random random;
        private DispatchErrorListener errorListener;

        private Builder() {
        }

        public Builder telemetrySource(TelemetrySource v) {
            this.telemetrySource = v;
            return this;
        }

        public Builder deliveryChannel(DeliveryChannel v) {
            this.deliveryChannel = v;
            return this;
        }

        public Builder settings(EngineSettings v) {
            this.settings = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        public Builder workerExecutor(Executor v) {
            this.workerExecutor = v;
            return this;
        }

        public Builder deliveryExecutor(Executor v) {
            this.deliveryExecutor = v;
            return this;
        }

        public Builder callExecutor(Executor v) {
            this.callExecutor = v;
            return this;
        }

        public Builder meterRegistry(MeterRegistry v) {
            this.meterRegistry = v;
            return this;
        }

        public Builder correlationIds(Supplier<String> v) {
            this.correlationIds = v;
            return this;
        }

        public Builder random(Random v) {
            this.random = v;
            return this;
        }

        public Builder errorListener(DispatchErrorListener v) {
            this.errorListener = v;
            return this;
        }

        public AlertingEngine build() {
            return new AlertingEngine(this);
        }
    }
}
