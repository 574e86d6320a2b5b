package com.alertwarden.service;

import com.alertwarden.core.dispatch.DeliveryChannel;
import com.alertwarden.core.dispatch.DeliveryException;
import com.alertwarden.core.model.NotificationPayload;
import com.alertwarden.core.model.Receiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Delivery channel that writes every notification to the
 * {@code com.alertwarden.notifications} logger.
 *
 * <p>
 * Transport to email, SMS or webhook endpoints happens outside this process;
 * the log line carries the receiver and the JSON payload a transport needs,
 * including the idempotency key.
 * </p>
 *
 * @since 1.0.0
 */
public class LoggingDeliveryChannel implements DeliveryChannel {

    private static final Logger NOTIFICATIONS = LoggerFactory.getLogger("com.alertwarden.notifications");

    private final PayloadSerializer serializer;

    public LoggingDeliveryChannel(PayloadSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "PayloadSerializer must not be null");
    }

    @Override
    public void deliver(Receiver receiver, NotificationPayload payload) throws DeliveryException {
        byte[] json = serializer.serialize(payload);
        if (json.length == 0) {
            throw new DeliveryException("Malformed payload for " + payload.getIdempotencyKey());
        }
        NOTIFICATIONS.info("{} [{}] key={} {}", receiver.kind(), receiver.target(),
                payload.getIdempotencyKey(), new String(json, StandardCharsets.UTF_8));
    }
}
