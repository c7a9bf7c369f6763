/**
 * System-wide alert storm detection with cooldown.
 *
 * @since 1.0.0
 */
package com.alertgate.core.storm;
