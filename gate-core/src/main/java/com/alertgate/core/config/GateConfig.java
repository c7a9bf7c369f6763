package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;
import com.alertgate.core.model.AlertRule;
import com.alertgate.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level gate configuration.
 *
 * <p>
 * Expected structure (shown as YAML):
 * </p>
 *
 * <pre>
 * storm:
 *   threshold: 100
 *   windowSeconds: 60
 *   cooldownSeconds: 300
 * quietHours:
 *   startTime: "22:00"
 *   endTime: "07:00"
 *   timezone: Europe/Berlin
 * rules:
 *   - id: cpu-high
 *     eventType: router.cpu.high
 *     severity: WARNING
 *     channels: [ops-email]
 *     throttle: { maxAlerts: 3, periodSeconds: 60, groupByField: interface }
 * </pre>
 *
 * @since 1.0.0
 */
public final class GateConfig {

    private final StormConfig storm;
    private final QuietHoursConfig quietHours;
    private final List<AlertRule> rules;

    public GateConfig(StormConfig storm, QuietHoursConfig quietHours, List<AlertRule> rules) {
        this.storm = storm != null ? storm : StormConfig.defaults();
        this.quietHours = quietHours != null ? quietHours : QuietHoursConfig.NONE;
        this.rules = rules != null ? Collections.unmodifiableList(new ArrayList<>(rules)) : List.of();
    }

    /**
     * @return storm defaults, no quiet hours, no rules
     */
    public static GateConfig empty() {
        return new GateConfig(null, null, null);
    }

    /**
     * Convert a decoded configuration tree.
     *
     * <p>
     * Every section is converted even after an earlier one fails, so that a
     * single {@link ConfigurationException} lists all problems at once.
     * </p>
     *
     * @param raw decoded root map; {@code null} yields {@link #empty()}
     * @return the validated configuration
     * @throws ConfigurationException if one or more sections are invalid
     */
    public static GateConfig fromMap(Map<String, ?> raw) {
        if (raw == null) {
            return empty();
        }
        List<String> errors = new ArrayList<>();

        StormConfig storm = null;
        try {
            Map<String, Object> section = ConfigValues.optionalMap(raw, "storm");
            storm = section != null ? StormConfig.fromMap(section) : StormConfig.defaults();
        } catch (ConfigurationException e) {
            errors.add("storm: " + e.getMessage());
        }

        QuietHoursConfig quietHours = null;
        try {
            Map<String, Object> section = ConfigValues.optionalMap(raw, "quietHours");
            quietHours = section != null ? QuietHoursConfig.fromMap(section) : QuietHoursConfig.NONE;
        } catch (ConfigurationException e) {
            errors.add("quietHours: " + e.getMessage());
        }

        List<AlertRule> rules = new ArrayList<>();
        Object rawRules = raw.get("rules");
        if (rawRules != null && !(rawRules instanceof List<?>)) {
            errors.add("rules must be a list");
        } else if (rawRules != null) {
            List<?> list = (List<?>) rawRules;
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < list.size(); i++) {
                try {
                    AlertRule rule = ruleFromMap(list.get(i), i);
                    if (!ids.add(rule.getId())) {
                        throw new ConfigurationException("duplicate rule id '" + rule.getId() + "'");
                    }
                    rules.add(rule);
                } catch (ConfigurationException | IllegalStateException e) {
                    errors.add("rules[" + i + "]: " + e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Gate configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return new GateConfig(storm, quietHours, rules);
    }

    private static AlertRule ruleFromMap(Object element, int index) {
        if (!(element instanceof Map<?, ?> map)) {
            throw new ConfigurationException("rule at index " + index + " must be a map");
        }
        Map<String, Object> raw = ConfigValues.toStringKeys(map);

        AlertRule rule = new AlertRule();
        rule.setId(ConfigValues.requiredString(raw, "id"));
        rule.setName(ConfigValues.optionalString(raw, "name", null));
        rule.setEventType(ConfigValues.optionalString(raw, "eventType", null));
        rule.setSeverity(Severity.parse(ConfigValues.optionalString(raw, "severity", "WARNING")));
        rule.setEnabled(ConfigValues.optionalBoolean(raw, "enabled", true));

        Object channels = raw.get("channels");
        if (channels != null) {
            if (!(channels instanceof List<?> list)) {
                throw new ConfigurationException("channels must be an array");
            }
            List<String> ids = new ArrayList<>();
            for (Object c : list) {
                ids.add(String.valueOf(c));
            }
            rule.setChannels(ids);
        }

        Map<String, Object> throttle = ConfigValues.optionalMap(raw, "throttle");
        if (throttle != null) {
            rule.setThrottle(ThrottleConfig.fromMap(throttle));
        }
        Map<String, Object> quietHours = ConfigValues.optionalMap(raw, "quietHours");
        if (quietHours != null) {
            rule.setQuietHours(QuietHoursConfig.fromMap(quietHours));
        }

        rule.validate();
        return rule;
    }

    public StormConfig getStorm() {
        return storm;
    }

    public QuietHoursConfig getQuietHours() {
        return quietHours;
    }

    /**
     * @return unmodifiable list of rules
     */
    public List<AlertRule> getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return "GateConfig{storm=" + storm + ", quietHours=" + quietHours + ", rules=" + rules + '}';
    }
}
