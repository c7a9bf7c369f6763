/**
 * Per-device holding of quiet-hours alerts and their digest rendering.
 *
 * @since 1.0.0
 */
package com.alertgate.core.digest;
