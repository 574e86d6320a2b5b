package com.alertwarden.core.dispatch;

import com.alertwarden.core.metrics.EngineMetrics;
import com.alertwarden.core.model.AlertEvent;
import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AttemptStatus;
import com.alertwarden.core.model.NotificationAttempt;
import com.alertwarden.core.model.NotificationPayload;
import com.alertwarden.core.model.Receiver;
import com.alertwarden.core.registry.ActionGroupNotFoundException;
import com.alertwarden.core.registry.ActionGroupRegistry;
import com.alertwarden.core.registry.RoutingTable;
import com.alertwarden.core.support.BoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Notification dispatcher.
 *
 * <p>
 * Routes lifecycle events to receivers and tracks one
 * {@link NotificationAttempt} per receiver and event.
 * </p>
 *
 * <h3>Routing</h3>
 * <ul>
 *   <li>{@code FIRED} / {@code STILL_FIRING}: receivers of the rule's action
 *       groups plus the escalation groups for its severity, read from the
 *       routing table the evaluation started with. The targeted receivers are
 *       recorded against the correlation id.</li>
 *   <li>{@code RESOLVED}: the recorded receivers that received a Fired or
 *       StillFiring notice, or may still receive one through a pending retry,
 *       whatever the action groups say now. A receiver whose every firing
 *       notice was given up is left out.</li>
 * </ul>
 *
 * <h3>Delivery</h3>
 * <p>
 * Every receiver is an independent attempt on the delivery executor, bounded
 * by the dispatch timeout. A failed attempt is rescheduled with exponential
 * backoff and picked up by {@link #processDue()}; once the retry policy is
 * exhausted it becomes {@code GIVEN_UP}, is logged at error level and
 * reported to the {@link DispatchErrorListener}. Nothing here ever feeds back
 * into the alert state.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ActionGroupRegistry registry;
    private final DeliveryChannel channel;
    private final Executor deliveryExecutor;
    private final Executor callExecutor;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Duration deliveryTimeout;
    private final Duration retention;
    private final EngineMetrics metrics;
    private final DispatchErrorListener errorListener;

    private final Map<String, NotificationAttempt> attempts = new ConcurrentHashMap<>();
    private final Map<String, Set<Receiver>> notified = new ConcurrentHashMap<>();
    private final Map<String, Set<Receiver>> reached = new ConcurrentHashMap<>();
    private final Map<String, Set<Receiver>> unreachable = new ConcurrentHashMap<>();
    private final Map<String, Instant> resolvedEpisodes = new ConcurrentHashMap<>();
    private volatile Map<Integer, String> severityLabels = Map.of();

    private NotificationDispatcher(Builder b) {
        this.registry = Objects.requireNonNull(b.registry, "registry must not be null");
        this.channel = Objects.requireNonNull(b.channel, "DeliveryChannel must not be null");
        this.deliveryExecutor = Objects.requireNonNull(b.deliveryExecutor, "deliveryExecutor must not be null");
        this.callExecutor = Objects.requireNonNull(b.callExecutor, "callExecutor must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy must not be null");
        this.deliveryTimeout = Objects.requireNonNull(b.deliveryTimeout, "deliveryTimeout must not be null");
        this.retention = Objects.requireNonNull(b.retention, "retention must not be null");
        this.metrics = b.metrics != null ? b.metrics : EngineMetrics.inMemory();
        this.errorListener = b.errorListener != null ? b.errorListener : DispatchErrorListener.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Replace the severity labels carried in payloads.
     */
    public void updateSeverityLabels(Map<Integer, String> labels) {
        this.severityLabels = Map.copyOf(labels);
    }

    /**
     * Dispatch against the registry's current routing table.
     *
     * @see #dispatch(AlertEvent, RoutingTable)
     */
    public List<NotificationAttempt> dispatch(AlertEvent event) {
        return dispatch(event, registry.snapshot());
    }

    /**
     * Start delivering an event to its receivers. Returns once every attempt
     * has been handed to the delivery executor; it does not wait for delivery.
     *
     * @param event   lifecycle event
     * @param routing routing table in force when the evaluation that produced
     *                the event started
     * @return the attempts created, as first recorded (status {@code PENDING})
     */
    public List<NotificationAttempt> dispatch(AlertEvent event, RoutingTable routing) {
        Objects.requireNonNull(event, "AlertEvent must not be null");
        Objects.requireNonNull(routing, "RoutingTable must not be null");
        String correlationId = event.getCorrelationId();
        boolean resolution = event.getType() == AlertEventType.RESOLVED;
        List<Receiver> receivers = resolution ? resolutionTargets(correlationId) : firingTargets(event, routing);

        if (receivers.isEmpty()) {
            LOG.info("Rule [{}] {} (correlationId={}): no receivers to notify", event.getRuleId(),
                    event.getType(), correlationId);
            if (resolution) {
                resolvedEpisodes.put(correlationId, event.getOccurredAt());
            }
            return List.of();
        }

        NotificationPayload payload = NotificationPayload.from(event, severityLabel(event.getSeverity()));
        Instant now = clock.instant();
        List<NotificationAttempt> started = new ArrayList<>(receivers.size());
        for (Receiver receiver : receivers) {
            NotificationAttempt attempt = NotificationAttempt.first(UUID.randomUUID().toString(), receiver,
                    payload, now);
            attempts.put(attempt.getId(), attempt);
            started.add(attempt);
        }
        // only after the attempts are tracked, so purge sees the episode as open
        if (resolution) {
            resolvedEpisodes.put(correlationId, event.getOccurredAt());
        }
        LOG.debug("Dispatching {} for rule [{}] to {} receiver(s)", event.getType(), event.getRuleId(),
                receivers.size());
        started.forEach(this::submit);
        return started;
    }

    /**
     * Retry every failed attempt whose backoff has elapsed, then purge
     * terminal attempts older than the retention window.
     *
     * @return number of attempts resubmitted
     */
    public int processDue() {
        Instant now = clock.instant();
        int retried = 0;
        for (NotificationAttempt attempt : attempts.values()) {
            if (attempt.getStatus() != AttemptStatus.FAILED || now.isBefore(attempt.getNextRetryAt())) {
                continue;
            }
            NotificationAttempt retry = attempt.retry(now);
            // only one caller wins the claim
            if (attempts.replace(attempt.getId(), attempt, retry)) {
                LOG.debug("Retrying {} to {} (attempt {}/{})", retry.getPayload().getEventType(),
                        retry.getReceiver().key(), retry.getAttemptNumber(), retryPolicy.getMaxAttempts());
                submit(retry);
                retried++;
            }
        }
        purge(now);
        return retried;
    }

    /**
     * @return every tracked attempt for the correlation id
     */
    public List<NotificationAttempt> attemptsFor(String correlationId) {
        return attempts.values().stream()
                .filter(a -> a.getAlertInstanceCorrelationId().equals(correlationId))
                .sorted(Comparator.comparing(NotificationAttempt::getUpdatedAt)
                        .thenComparing(NotificationAttempt::getId))
                .toList();
    }

    /**
     * @return receivers targeted by Fired/StillFiring for the correlation id
     */
    public Set<Receiver> notifiedReceivers(String correlationId) {
        return notified.getOrDefault(correlationId, Set.of());
    }

    /**
     * @return attempts that exhausted their retries and are still retained
     */
    public List<NotificationAttempt> givenUpAttempts() {
        return attempts.values().stream()
                .filter(a -> a.getStatus() == AttemptStatus.GIVEN_UP)
                .sorted(Comparator.comparing(NotificationAttempt::getUpdatedAt))
                .toList();
    }

    /**
     * @return number of attempts not yet in a terminal status
     */
    public int outstanding() {
        return (int) attempts.values().stream().filter(a -> !a.getStatus().isTerminal()).count();
    }

    // ---------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------

    private List<Receiver> firingTargets(AlertEvent event, RoutingTable routing) {
        List<Receiver> receivers;
        try {
            receivers = routing.listReceiversFor(event.getSeverity(), event.getRule().getActionGroupRefs());
        } catch (ActionGroupNotFoundException e) {
            LOG.error("Rule [{}] {}: cannot route notification: {}", event.getRuleId(), event.getType(),
                    e.getMessage());
            return List.of();
        }
        notified.compute(event.getCorrelationId(), (id, previous) -> {
            Set<Receiver> merged = previous == null ? new LinkedHashSet<>() : new LinkedHashSet<>(previous);
            merged.addAll(receivers);
            return Collections.unmodifiableSet(merged);
        });
        return receivers;
    }

    private List<Receiver> resolutionTargets(String correlationId) {
        Set<Receiver> delivered = reached.getOrDefault(correlationId, Set.of());
        Set<Receiver> lost = unreachable.getOrDefault(correlationId, Set.of());
        return notified.getOrDefault(correlationId, Set.of()).stream()
                .filter(r -> delivered.contains(r) || !lost.contains(r))
                .toList();
    }

    private static void remember(Map<String, Set<Receiver>> index, String correlationId, Receiver receiver) {
        index.compute(correlationId, (id, previous) -> {
            Set<Receiver> merged = previous == null ? new LinkedHashSet<>() : new LinkedHashSet<>(previous);
            merged.add(receiver);
            return Collections.unmodifiableSet(merged);
        });
    }

    private static boolean isFiringNotice(NotificationAttempt attempt) {
        return attempt.getPayload().getEventType() != AlertEventType.RESOLVED;
    }

    private String severityLabel(int severity) {
        return severityLabels.getOrDefault(severity, "Sev" + severity);
    }

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------

    private void submit(NotificationAttempt attempt) {
        try {
            deliveryExecutor.execute(() -> deliver(attempt));
        } catch (RejectedExecutionException e) {
            onFailure(attempt, "delivery executor rejected the attempt");
        }
    }

    private void deliver(NotificationAttempt attempt) {
        try {
            BoundedCall.call(() -> {
                channel.deliver(attempt.getReceiver(), attempt.getPayload());
                return null;
            }, deliveryTimeout, callExecutor);
        } catch (TimeoutException e) {
            onFailure(attempt, "timed out after " + deliveryTimeout.toMillis() + " ms");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            onFailure(attempt, cause instanceof DeliveryException ? cause.getMessage() : String.valueOf(cause));
            return;
        } catch (RejectedExecutionException e) {
            onFailure(attempt, "call executor rejected the attempt");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onFailure(attempt, "interrupted");
            return;
        }

        NotificationAttempt sent = attempt.sent(clock.instant());
        attempts.replace(attempt.getId(), attempt, sent);
        metrics.recordNotification(AttemptStatus.SENT);
        if (isFiringNotice(attempt)) {
            remember(reached, attempt.getAlertInstanceCorrelationId(), attempt.getReceiver());
        }
        LOG.debug("Delivered {} for rule [{}] to {} (attempt {})", attempt.getPayload().getEventType(),
                attempt.getPayload().getRuleId(), attempt.getReceiver().key(), attempt.getAttemptNumber());
    }

    private void onFailure(NotificationAttempt attempt, String error) {
        Instant now = clock.instant();
        String ruleId = attempt.getPayload().getRuleId();

        if (retryPolicy.canRetry(attempt.getAttemptNumber())) {
            Instant retryAt = now.plus(retryPolicy.backoffAfter(attempt.getAttemptNumber()));
            attempts.replace(attempt.getId(), attempt, attempt.failed(now, retryAt, error));
            metrics.recordNotification(AttemptStatus.FAILED);
            LOG.warn("Delivery of {} for rule [{}] to {} failed (attempt {}/{}): {}; retrying at {}",
                    attempt.getPayload().getEventType(), ruleId, attempt.getReceiver().key(),
                    attempt.getAttemptNumber(), retryPolicy.getMaxAttempts(), error, retryAt);
            return;
        }

        NotificationAttempt givenUp = attempt.givenUp(now, error);
        attempts.replace(attempt.getId(), attempt, givenUp);
        metrics.recordNotification(AttemptStatus.GIVEN_UP);
        if (isFiringNotice(attempt)) {
            remember(unreachable, attempt.getAlertInstanceCorrelationId(), attempt.getReceiver());
        }
        LOG.error("Giving up delivery of {} for rule [{}] to {} after {} attempt(s): {} (correlationId={})",
                attempt.getPayload().getEventType(), ruleId, attempt.getReceiver().key(),
                attempt.getAttemptNumber(), error, attempt.getAlertInstanceCorrelationId());
        try {
            errorListener.onGivenUp(givenUp);
        } catch (RuntimeException e) {
            LOG.error("DispatchErrorListener failed for attempt {}", givenUp.getId(), e);
        }
    }

    // ---------------------------------------------------------------
    // Garbage collection
    // ---------------------------------------------------------------

    private void purge(Instant now) {
        Instant cutoff = now.minus(retention);
        attempts.values().removeIf(a -> a.getStatus().isTerminal() && !a.getUpdatedAt().isAfter(cutoff));

        resolvedEpisodes.keySet().removeIf(correlationId -> {
            boolean open = attempts.values().stream()
                    .anyMatch(a -> a.getAlertInstanceCorrelationId().equals(correlationId)
                            && !a.getStatus().isTerminal());
            if (open) {
                return false;
            }
            notified.remove(correlationId);
            reached.remove(correlationId);
            unreachable.remove(correlationId);
            return true;
        });
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {

        private ActionGroupRegistry registry;
        private DeliveryChannel channel;
        private Executor deliveryExecutor;
        private Executor callExecutor;
        private Clock clock = Clock.systemUTC();
        private RetryPolicy retryPolicy = new RetryPolicy(Duration.ofSeconds(30), Duration.ofHours(1), 10);
        private Duration deliveryTimeout = Duration.ofSeconds(15);
        private Duration retention = Duration.ofHours(24);
        private EngineMetrics metrics;
        private DispatchErrorListener errorListener;

        private Builder() {
        }

        public Builder registry(ActionGroupRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder channel(DeliveryChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder deliveryExecutor(Executor deliveryExecutor) {
            this.deliveryExecutor = deliveryExecutor;
            return this;
        }

        /**
         * Executor the blocking {@link DeliveryChannel#deliver} call runs on, so
         * it can be abandoned on timeout.
         */
        public Builder callExecutor(Executor callExecutor) {
            this.callExecutor = callExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder deliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
            return this;
        }

        public Builder retention(Duration retention) {
            this.retention = retention;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder errorListener(DispatchErrorListener errorListener) {
            this.errorListener = errorListener;
            return this;
        }

        public NotificationDispatcher build() {
            return new NotificationDispatcher(this);
        }
    }
}
