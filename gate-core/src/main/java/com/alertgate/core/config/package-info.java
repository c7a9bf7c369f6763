/**
 * Typed configuration converted from loosely-typed maps.
 *
 * <p>
 * {@link com.alertgate.core.config.ThrottleConfig},
 * {@link com.alertgate.core.config.StormConfig} and
 * {@link com.alertgate.core.config.QuietHoursConfig} each expose a
 * {@code fromMap} parser that accepts integer and floating-point number
 * encodings and reports problems as
 * {@link com.alertgate.core.ConfigurationException}.
 * {@link com.alertgate.core.config.GateConfigLoader} reads the whole tree
 * from YAML.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertgate.core.config;
