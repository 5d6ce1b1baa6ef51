package com.payment.observability.alert.store;

import com.payment.observability.alert.domain.AlertEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory ring of the most recently detected alerts, newest first. Lost on restart; alerts are also
 * published to Kafka.
 */
@Component
public class RecentAlertsStore {

    private final int maxRecent;
    private final ConcurrentLinkedDeque<AlertEvent> recent = new ConcurrentLinkedDeque<>();

    public RecentAlertsStore(@Value("${payment.alerts.recent-store-size:100}") int maxRecent) {
        this.maxRecent = maxRecent;
    }

    public void add(AlertEvent alert) {
        recent.addFirst(alert);
        while (recent.size() > maxRecent) recent.pollLast();
    }

    public List<AlertEvent> getRecent(int limit) {
        List<AlertEvent> out = new ArrayList<>();
        for (AlertEvent a : recent) {
            if (out.size() >= limit) break;
            out.add(a);
        }
        return out;
    }
}
