package com.deviceotp.service;

import com.deviceotp.config.DbConfig;
import com.deviceotp.dao.DeviceStore;
import com.deviceotp.dao.StorageException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Device lifecycle: Active after registration, Inactive after deactivation, no way back.
 * All coordination goes through single conditional statements in the store.
 */
@Component
public final class DeviceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

    static final Duration READ_RETRY_WAIT = Duration.ofMillis(50);

    private final DeviceStore store;
    private final Clock clock;
    private final Retry readRetry;

    public DeviceRegistry(DeviceStore store, DbConfig dbConfig, Clock clock) {
        this.store = store;
        this.clock = clock;
        int readRetries = Math.max(0, dbConfig.readRetries());
        // only idempotent reads go through this; writes fail on the first error
        this.readRetry = Retry.of("storage-read", RetryConfig.custom()
            .maxAttempts(readRetries + 1)
            .waitDuration(READ_RETRY_WAIT)
            .retryOnException(e -> e instanceof StorageException storage && storage.isTransient())
            .build());
        this.readRetry.getEventPublisher().onRetry(event -> logger.warn(
            "Transient storage failure, retry {}/{}: {}",
            event.getNumberOfRetryAttempts(),
            readRetries,
            event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()
        ));
    }

    public DeviceStore.DeviceRow register(String deviceId,
                                          String userId,
                                          String derivedKeyHash,
                                          byte[] encryptedSecret) {
        Instant createdAt = clock.instant();
        boolean inserted;
        try {
            inserted = store.insertDevice(deviceId, userId, derivedKeyHash, encryptedSecret, createdAt);
        } catch (StorageException e) {
            throw ApiException.storageUnavailable(e);
        }
        if (!inserted) {
            throw ApiException.conflict("duplicate_device");
        }
        return new DeviceStore.DeviceRow(
            deviceId, userId, derivedKeyHash, encryptedSecret, true, createdAt, null, 0, null, null
        );
    }

    public DeviceStore.DeviceRow load(String deviceId) {
        return find(deviceId).orElseThrow(() -> ApiException.notFound("device_not_found"));
    }

    public Optional<DeviceStore.DeviceRow> find(String deviceId) {
        return read("findDevice", () -> store.findDevice(deviceId));
    }

    public List<DeviceStore.DeviceRow> listByUser(String userId) {
        return read("listDevicesByUser", () -> store.listDevicesByUser(userId));
    }

    /**
     * Consumes {@code movingFactor} for the device. Fails as a replay when another request already
     * consumed this or a later factor, and as inactive when deactivation committed first.
     */
    public void recordSuccessfulVerification(String deviceId, long movingFactor, Instant usedAt) {
        boolean updated;
        try {
            updated = store.markVerified(deviceId, movingFactor, usedAt);
        } catch (StorageException e) {
            throw ApiException.storageUnavailable(e);
        }
        if (updated) {
            return;
        }

        var current = find(deviceId).orElseThrow(() -> ApiException.notFound("device_not_found"));
        if (!current.active()) {
            throw ApiException.forbidden("device_inactive");
        }
        throw ApiException.unauthorized("replay_detected");
    }

    /**
     * @return the deactivation timestamp
     */
    public Instant deactivate(String deviceId) {
        Instant deactivatedAt = clock.instant();
        boolean updated;
        try {
            updated = store.deactivate(deviceId, deactivatedAt);
        } catch (StorageException e) {
            throw ApiException.storageUnavailable(e);
        }
        if (updated) {
            return deactivatedAt;
        }

        find(deviceId).orElseThrow(() -> ApiException.notFound("device_not_found"));
        throw ApiException.conflict("already_inactive");
    }

    private <T> T read(String operation, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(readRetry, call).get();
        } catch (StorageException e) {
            logger.error("Storage read {} failed", operation);
            throw ApiException.storageUnavailable(e);
        }
    }
}
