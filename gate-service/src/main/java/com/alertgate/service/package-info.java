/**
 * Standalone host for the alert gate: reads JSON events from standard input,
 * routes admitted alerts to their channels, runs the digest and throttle
 * summary schedules and serves health and status over HTTP.
 */
package com.alertgate.service;
