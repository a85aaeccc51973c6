package hasync.core.service.common;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.model.common.StorageException;

/**
 * Failure policy for repository calls.
 *
 * <p>Idempotent reads are retried once after a short backoff. Writes are not retried.
 * A {@link StorageException} that survives is logged with a correlation id and
 * surfaced as {@link ErrorCode#TRANSIENT_FAILURE}.
 */
public final class StorageCalls {

    private static final Logger LOG = Logger.getLogger(StorageCalls.class);

    static final Duration READ_BACKOFF = Duration.ofMillis(50);

    private StorageCalls() {}

    public static <T> Uni<T> read(String operation, Supplier<Uni<T>> call) {
        return Uni.createFrom()
                .deferred(call::get)
                .onFailure(StorageException.class)
                .invoke(e -> LOG.debugf("Storage read %s failed, retrying: %s", operation, e.getMessage()))
                .onFailure(StorageException.class)
                .retry()
                .withBackOff(READ_BACKOFF, READ_BACKOFF)
                .atMost(1)
                .onFailure(StorageException.class)
                .transform(e -> transientFailure(operation, e));
    }

    public static <T> Uni<T> write(String operation, Supplier<Uni<T>> call) {
        return Uni.createFrom()
                .deferred(call::get)
                .onFailure(StorageException.class)
                .transform(e -> transientFailure(operation, e));
    }

    private static ServiceException transientFailure(String operation, Throwable cause) {
        final var correlationId = UUID.randomUUID().toString().substring(0, 8);
        LOG.errorf(cause, "Storage %s failed [correlationId=%s]", operation, correlationId);
        return new ServiceException(
                ErrorCode.TRANSIENT_FAILURE, "Storage " + operation + " failed", correlationId, cause);
    }
}
