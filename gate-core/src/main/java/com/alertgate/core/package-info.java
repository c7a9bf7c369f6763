/**
 * Admission control for triggered alerts.
 *
 * <p>
 * An alert passes three gates in order: the global
 * {@link com.alertgate.core.storm.StormDetector}, the per-rule
 * {@link com.alertgate.core.throttle.ThrottleManager} and the
 * {@link com.alertgate.core.quiet.QuietHoursFilter}. Alerts held back by
 * quiet hours wait in a holding queue until they can be delivered as a
 * digest. {@link com.alertgate.core.pipeline.AdmissionPipeline} wires the
 * gates together.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertgate.core;
