package com.alertwarden.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Delivery of one notification to one receiver, across all its retries.
 *
 * <p>
 * Immutable; the dispatcher replaces the stored instance on every status
 * change. {@code attemptNumber} is the 1-based number of the most recent (or
 * currently running) delivery call.
 * </p>
 *
 * @since 1.0.0
 */
public final class NotificationAttempt {

    private final String id;
    private final Receiver receiver;
    private final NotificationPayload payload;
    private final int attemptNumber;
    private final AttemptStatus status;
    private final Instant nextRetryAt;
    private final Instant updatedAt;
    private final String lastError;

    public NotificationAttempt(String id, Receiver receiver, NotificationPayload payload, int attemptNumber,
            AttemptStatus status, Instant nextRetryAt, Instant updatedAt, String lastError) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.receiver = Objects.requireNonNull(receiver, "receiver must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.attemptNumber = attemptNumber;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.nextRetryAt = nextRetryAt;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        this.lastError = lastError;
    }

    /**
     * First attempt, due immediately.
     */
    public static NotificationAttempt first(String id, Receiver receiver, NotificationPayload payload, Instant now) {
        return new NotificationAttempt(id, receiver, payload, 1, AttemptStatus.PENDING, now, now, null);
    }

    public NotificationAttempt sent(Instant now) {
        return new NotificationAttempt(id, receiver, payload, attemptNumber, AttemptStatus.SENT, null, now, null);
    }

    public NotificationAttempt failed(Instant now, Instant retryAt, String error) {
        return new NotificationAttempt(id, receiver, payload, attemptNumber, AttemptStatus.FAILED, retryAt, now, error);
    }

    public NotificationAttempt givenUp(Instant now, String error) {
        return new NotificationAttempt(id, receiver, payload, attemptNumber, AttemptStatus.GIVEN_UP, null, now, error);
    }

    /**
     * @return the next attempt, pending and numbered one higher
     */
    public NotificationAttempt retry(Instant now) {
        return new NotificationAttempt(id, receiver, payload, attemptNumber + 1, AttemptStatus.PENDING, now, now,
                lastError);
    }

    public String getId() {
        return id;
    }

    public String getAlertInstanceCorrelationId() {
        return payload.getCorrelationId();
    }

    public Receiver getReceiver() {
        return receiver;
    }

    public NotificationPayload getPayload() {
        return payload;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public AttemptStatus getStatus() {
        return status;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "NotificationAttempt{" +
                "id='" + id + '\'' +
                ", receiver=" + receiver.key() +
                ", eventType=" + payload.getEventType() +
                ", attemptNumber=" + attemptNumber +
                ", status=" + status +
                ", nextRetryAt=" + nextRetryAt +
                '}';
    }
}
