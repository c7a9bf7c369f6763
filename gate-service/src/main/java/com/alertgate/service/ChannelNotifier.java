package com.alertgate.service;

import com.alertgate.core.DeliveryException;
import com.alertgate.core.QueueFullException;
import com.alertgate.core.model.QueuedNotification;
import com.alertgate.core.pipeline.EventPublisher;
import com.alertgate.core.quiet.QueueManagerSettings;
import com.alertgate.core.quiet.QuietHoursQueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Fans published alerts out to their notification channels.
 *
 * <p>
 * Every event is forwarded unchanged to the downstream publisher. Events
 * whose payload names {@code channels} additionally produce one
 * {@value #DISPATCH} event per channel, or are parked in the channel's
 * quiet-hours queue and later released as one {@value #BATCH} event.
 * A full channel queue falls back to immediate dispatch.
 * </p>
 */
public class ChannelNotifier implements EventPublisher, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelNotifier.class);

    static final String DISPATCH = "notification.dispatch";
    static final String BATCH = "notification.batch";

    private final EventPublisher downstream;
    private final QuietHoursQueueManager queues;

    /**
     * @param downstream receives every event and notification
     * @param settings   queue settings; the delivery callback is supplied here
     */
    public ChannelNotifier(EventPublisher downstream, QueueManagerSettings.Builder settings) {
        this.downstream = Objects.requireNonNull(downstream, "downstream must not be null");
        this.queues = new QuietHoursQueueManager(settings.deliveryCallback(this::deliverBatch).build());
    }

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        downstream.publish(eventType, payload);

        Object channels = payload.get("channels");
        if (!(channels instanceof List<?> list) || list.isEmpty()) {
            return;
        }
        String severity = String.valueOf(payload.get("severity"));
        boolean park = queues.shouldQueue(severity).isSuppress();
        for (Object channel : list) {
            QueuedNotification notification = toNotification(String.valueOf(channel), eventType, payload);
            if (park) {
                try {
                    queues.enqueue(notification);
                    continue;
                } catch (QueueFullException e) {
                    LOG.warn("{}, dispatching immediately", e.getMessage());
                }
            }
            downstream.publish(DISPATCH, toPayload(notification));
        }
    }

    /**
     * @return queued notification count per channel
     */
    public Map<String, Integer> queuedCounts() {
        return queues.getAllQueuedCounts();
    }

    QuietHoursQueueManager queues() {
        return queues;
    }

    /**
     * Flush parked notifications and stop the queue worker.
     */
    @Override
    public void close() {
        try {
            queues.flushAll();
        } catch (DeliveryException e) {
            LOG.error("Failed to flush channel queues on shutdown: {}", e.getMessage(), e);
        }
        queues.close();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void deliverBatch(List<QueuedNotification> batch) {
        Map<String, List<Map<String, Object>>> byChannel = new LinkedHashMap<>();
        for (QueuedNotification n : batch) {
            byChannel.computeIfAbsent(n.getChannelId(), c -> new ArrayList<>()).add(toPayload(n));
        }
        byChannel.forEach((channelId, notifications) -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("channel_id", channelId);
            payload.put("count", notifications.size());
            payload.put("notifications", notifications);
            downstream.publish(BATCH, payload);
        });
    }

    private static QueuedNotification toNotification(String channelId, String eventType, Map<String, Object> payload) {
        Object ruleId = payload.getOrDefault("rule_id", "alert");
        return QueuedNotification.builder()
                .channelId(channelId)
                .alertId(ruleId + "-" + UUID.randomUUID())
                .title(String.valueOf(payload.getOrDefault("title", eventType)))
                .message(payload.get("message") != null ? String.valueOf(payload.get("message")) : null)
                .severity(String.valueOf(payload.get("severity")))
                .eventType(eventType)
                .data(payload)
                .build();
    }

    private static Map<String, Object> toPayload(QueuedNotification n) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel_id", n.getChannelId());
        payload.put("alert_id", n.getAlertId());
        payload.put("title", n.getTitle());
        payload.put("message", n.getMessage());
        payload.put("severity", n.getSeverity());
        payload.put("event_type", n.getEventType());
        payload.put("queued_at", n.getQueuedAt());
        return payload;
    }
}
