/**
 * Composition of the storm, throttle and quiet-hours gates into one
 * admission decision per rule, plus digest flushing.
 *
 * <p>
 * {@link com.alertgate.core.pipeline.AdmissionPipeline} is the entry point
 * for callers that deliver alerts. Outbound events go through
 * {@link com.alertgate.core.pipeline.EventPublisher}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertgate.core.pipeline;
