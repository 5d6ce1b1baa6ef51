package com.payment.observability.alert.messaging;

import com.payment.observability.alert.domain.AlertEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes alerts to the application log. Default notifier when no chat webhook is configured.
 */
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public String sendAlert(AlertEvent alert) {
        log.warn("ALERT severity={} type={} title=\"{}\" message=\"{}\" provider={} alertId={}",
                alert.getSeverity().getValue(), alert.getType(), alert.getTitle(), alert.getMessage(),
                alert.getProvider(), alert.getAlertId());
        return "log-" + alert.getAlertId();
    }

    @Override
    public String name() {
        return "log";
    }
}
