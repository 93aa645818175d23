package natter.core.port.out;

import natter.core.model.chat.BroadcastReport;

/**
 * Port interface for recording chat metrics.
 */
public interface Metrics {

    boolean isEnabled();

    void incrementActiveConnections();

    void decrementActiveConnections();

    /**
     * Record a connection refused before admission.
     *
     * @param reason short reason tag, e.g. {@code unauthenticated}
     */
    void recordConnectionRefused(String reason);

    /**
     * Record one broadcast and its per-recipient outcomes.
     *
     * @param report the broadcast report
     */
    void recordBroadcast(BroadcastReport report);

    void recordRedisTimeout(String repository, String operation);

    void recordRedisFailure(String repository, String operation);
}
