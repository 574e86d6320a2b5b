package com.alertwarden.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One notification channel inside an {@link ActionGroup}.
 *
 * <p>
 * The set of variants is closed ({@link EmailReceiver}, {@link SmsReceiver},
 * {@link WebhookReceiver}, {@link RoleReceiver}); the constructor is package
 * private so no other subtype can exist.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * Two receivers are equal when they have the same {@link #kind()} and
 * {@link #target()}. The display name does not take part, so the same mailbox
 * reachable through two action groups is notified once per transition.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class Receiver {

    /** Receiver variants. */
    public enum Kind {
        EMAIL, SMS, WEBHOOK, ROLE
    }

    private final String name;

    Receiver(String name) {
        this.name = name;
    }

    /**
     * @return display name from configuration, may be {@code null}
     */
    public String getName() {
        return name;
    }

    /**
     * @return the variant of this receiver
     */
    public abstract Kind kind();

    /**
     * @return canonical delivery target (address, number, URI or role id)
     */
    public abstract String target();

    /**
     * Check that this receiver is well-formed.
     *
     * @return list of problems, empty when valid
     */
    public abstract List<String> problems();

    /**
     * @return stable key combining kind and target, e.g. {@code EMAIL:ops@example.com}
     */
    public String key() {
        return kind() + ":" + target();
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Receiver that))
            return false;
        return kind() == that.kind() && Objects.equals(target(), that.target());
    }

    @Override
    public final int hashCode() {
        return Objects.hash(kind(), target());
    }

    @Override
    public String toString() {
        return kind() + "{name='" + name + "', target='" + target() + "'}";
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
