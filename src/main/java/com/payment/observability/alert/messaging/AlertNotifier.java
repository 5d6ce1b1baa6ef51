package com.payment.observability.alert.messaging;

import com.payment.observability.alert.domain.AlertEvent;

/**
 * Delivers an alert to a human channel.
 */
public interface AlertNotifier {

    /**
     * Sends the alert and returns the channel's message id. Delivery failures are thrown.
     */
    String sendAlert(AlertEvent alert);

    String name();
}
