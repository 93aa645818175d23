package natter.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import natter.core.model.common.UpstreamUnavailableException;
import natter.core.port.out.Metrics;

/**
 * Helper for applying timeouts and failure handling to Redis operations.
 *
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts become {@link RedisTimeoutException},
 *       other failures become {@link UpstreamUnavailableException}. Use for session
 *       and account operations.</li>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: returns empty Optional on timeout or any
 *       failure. Use for reads where missing data has a sensible fallback.</li>
 * </ul>
 *
 * <p>Timeouts are counted in {@code natter.redis.timeouts.total} and other failures in
 * {@code natter.redis.failures.total}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param repositoryName the repository name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that must fail when Redis cannot answer.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link UpstreamUnavailableException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof UpstreamUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return new UpstreamUnavailableException(
                            "Redis operation failed: " + operationName + " in " + repositoryName, error);
                });
    }

    /**
     * Apply timeout with graceful degradation to empty Optional.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that returns empty Optional on timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (graceful): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (graceful): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return Optional.empty();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordRedisTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordRedisFailure(repositoryName, operationName);
        }
    }

    /**
     * A Redis operation exceeded the configured timeout.
     */
    public static class RedisTimeoutException extends UpstreamUnavailableException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
