/**
 * Per-rule sliding-window throttling.
 *
 * <p>
 * {@link com.alertgate.core.throttle.ThrottleManager} is the entry point.
 * Window state is kept in fixed-capacity timestamp rings, one per rule and
 * group key.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertgate.core.throttle;
