package com.alertgate.core.model;

import com.alertgate.core.config.QuietHoursConfig;
import com.alertgate.core.config.ThrottleConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An alert rule as the admission pipeline sees it.
 *
 * <p>
 * Rule definitions are stored and matched elsewhere; the gate only needs the
 * rule's identity, severity, target channels and its throttle and quiet-hours
 * settings. Call {@link #validate()} after populating from configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String eventType;
    private Severity severity = Severity.WARNING;
    private boolean enabled = true;
    private List<String> channels = new ArrayList<>();
    private ThrottleConfig throttle = ThrottleConfig.NONE;
    private QuietHoursConfig quietHours = QuietHoursConfig.NONE;

    public AlertRule() {
    }

    public AlertRule(String id, String name, Severity severity) {
        this.id = id;
        this.name = name;
        this.severity = severity;
    }

    /**
     * @throws IllegalStateException if the id is missing or severity is unset
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (severity == null) {
            errors.add("Rule '" + id + "' requires 'severity'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name != null ? name : id;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return unmodifiable list of notification channel ids
     */
    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public ThrottleConfig getThrottle() {
        return throttle;
    }

    public void setThrottle(ThrottleConfig throttle) {
        this.throttle = throttle != null ? throttle : ThrottleConfig.NONE;
    }

    public QuietHoursConfig getQuietHours() {
        return quietHours;
    }

    public void setQuietHours(QuietHoursConfig quietHours) {
        this.quietHours = quietHours != null ? quietHours : QuietHoursConfig.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", eventType='" + eventType + '\'' +
                ", severity=" + severity +
                ", enabled=" + enabled +
                ", throttle=" + throttle +
                ", quietHours=" + quietHours +
                '}';
    }
}
