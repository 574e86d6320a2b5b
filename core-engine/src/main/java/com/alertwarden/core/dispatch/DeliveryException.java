package com.alertwarden.core.dispatch;

/**
 * The delivery collaborator could not hand a notification to its receiver.
 * Always treated as transient: the attempt is retried until the retry policy
 * gives up.
 *
 * @since 1.0.0
 */
public class DeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
