package com.alertgate.core;

/**
 * Backpressure signal: the target channel queue is already at its maximum
 * size. Whether to deliver immediately or drop is up to the caller.
 *
 * @since 1.0.0
 */
public class QueueFullException extends AlertGateException {

    private static final long serialVersionUID = 1L;

    private final String channelId;
    private final int maxSize;

    public QueueFullException(String channelId, int maxSize) {
        super("queue full for channel '" + channelId + "' (max " + maxSize + ")");
        this.channelId = channelId;
        this.maxSize = maxSize;
    }

    public String getChannelId() {
        return channelId;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
