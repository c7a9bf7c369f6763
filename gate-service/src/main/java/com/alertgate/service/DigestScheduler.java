package com.alertgate.service;

import com.alertgate.core.model.AlertRule;
import com.alertgate.core.pipeline.AdmissionPipeline;
import com.alertgate.core.pipeline.DigestMessage;
import com.alertgate.core.pipeline.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Releases quiet-hours digests once their window has closed.
 *
 * <p>
 * Each run drains the pipeline's alert queue and publishes one
 * {@link DigestMessage#EVENT_TYPE} event per device, addressed to the
 * channels of the rule that raised the first queued alert.
 * </p>
 */
public class DigestScheduler implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(DigestScheduler.class);

    private final AdmissionPipeline pipeline;
    private final EventPublisher publisher;

    public DigestScheduler(AdmissionPipeline pipeline, EventPublisher publisher) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * @return number of digests published
     */
    public int flushOnce() {
        List<DigestMessage> digests = pipeline.flushDigests();
        for (DigestMessage digest : digests) {
            Map<String, Object> payload = digest.toPayload();
            payload.put("channels", pipeline.getRule(digest.getRuleId())
                    .map(AlertRule::getChannels)
                    .orElse(List.of()));
            publisher.publish(DigestMessage.EVENT_TYPE, payload);
        }
        return digests.size();
    }

    @Override
    public void run() {
        try {
            flushOnce();
        } catch (RuntimeException e) {
            LOG.error("Digest flush failed: {}", e.getMessage(), e);
        }
    }
}
