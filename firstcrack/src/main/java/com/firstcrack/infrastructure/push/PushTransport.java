package com.firstcrack.infrastructure.push;

import com.firstcrack.domain.notification.StagePayloadSet;

/**
 * Delivery channel for stage notifications.
 *
 * Delivery is at-least-once at best; callers do not retry.
 */
public interface PushTransport {

    /**
     * Hand one stage notification to the delivery service.
     *
     * @return message id assigned by the delivery service
     * @throws TransportSendException if the service rejected or never received the message
     */
    String send(StagePayloadSet payload);

    /**
     * Short name for logs and health output.
     */
    String name();
}
