/**
 * Values that flow through the gate.
 *
 * <ul>
 * <li>{@link com.alertgate.core.model.AlertEvent}: free-form triggered event</li>
 * <li>{@link com.alertgate.core.model.AlertRule}: the rule that matched it</li>
 * <li>{@link com.alertgate.core.model.QueuedAlert}: alert held for a per-device digest</li>
 * <li>{@link com.alertgate.core.model.QueuedNotification}: notification held in a channel queue</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertgate.core.model;
