package com.deviceotp.dao;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable device table. Every mutation is a single atomic statement; callers never hold device
 * state across requests.
 */
public interface DeviceStore {

    record DeviceRow(String deviceId,
                     String userId,
                     String derivedKeyHash,
                     byte[] encryptedSecret,
                     boolean active,
                     Instant createdAt,
                     Instant lastUsed,
                     long usageCount,
                     Long lastMovingFactor,
                     Instant deactivatedAt) {}

    /**
     * @return false when a device with this id already exists, active or not
     */
    boolean insertDevice(String deviceId,
                         String userId,
                         String derivedKeyHash,
                         byte[] encryptedSecret,
                         Instant createdAt);

    Optional<DeviceRow> findDevice(String deviceId);

    List<DeviceRow> listDevicesByUser(String userId);

    /**
     * Increments usage, advances last_used and stores the moving factor, but only while the
     * device is active and the factor is above the stored high-water mark.
     *
     * @return false when the condition did not hold (or the device is missing)
     */
    boolean markVerified(String deviceId, long movingFactor, Instant usedAt);

    /**
     * @return false when the device is missing or already inactive
     */
    boolean deactivate(String deviceId, Instant deactivatedAt);

    boolean ping();
}
