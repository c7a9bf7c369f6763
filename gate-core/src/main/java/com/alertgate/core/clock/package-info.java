/**
 * Time sources. Components depend on {@link java.time.Clock};
 * {@link com.alertgate.core.clock.MutableClock} is the deterministic variant.
 */
package com.alertgate.core.clock;
