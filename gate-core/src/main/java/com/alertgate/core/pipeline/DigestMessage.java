package com.alertgate.core.pipeline;

import com.alertgate.core.model.QueuedAlert;
import com.alertgate.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rendered quiet-hours digest for one device.
 *
 * @since 1.0.0
 */
public final class DigestMessage {

    /** Event type under which digests are published. */
    public static final String EVENT_TYPE = "alert.digest";

    private final String deviceId;
    private final String ruleId;
    private final Severity severity;
    private final String title;
    private final String body;
    private final List<QueuedAlert> alerts;

    DigestMessage(String deviceId, String ruleId, Severity severity, String title, String body,
            List<QueuedAlert> alerts) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.ruleId = ruleId;
        this.severity = severity;
        this.title = title;
        this.body = body;
        this.alerts = Collections.unmodifiableList(alerts);
    }

    public String getDeviceId() {
        return deviceId;
    }

    /** Rule of the first alert in the digest. */
    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public List<QueuedAlert> getAlerts() {
        return alerts;
    }

    public int getAlertCount() {
        return alerts.size();
    }

    /**
     * @return the payload published with {@link #EVENT_TYPE}
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rule_id", ruleId);
        payload.put("device_id", deviceId);
        payload.put("severity", severity.name());
        payload.put("title", title);
        payload.put("message", body);
        payload.put("digest", true);
        payload.put("alert_count", alerts.size());
        return payload;
    }

    @Override
    public String toString() {
        return "DigestMessage{deviceId='" + deviceId + "', title='" + title + "'}";
    }
}
