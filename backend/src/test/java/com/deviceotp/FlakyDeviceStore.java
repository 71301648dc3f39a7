package com.deviceotp;

import com.deviceotp.dao.DeviceStore;
import com.deviceotp.dao.StorageException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegates to another store but fails the next {@code failures} reads, or every write when
 * {@code failWrites} is set.
 */
public final class FlakyDeviceStore implements DeviceStore {
    private final DeviceStore delegate;
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger readCalls = new AtomicInteger();
    private volatile boolean transientFailure = true;
    private volatile boolean failWrites;

    public FlakyDeviceStore(DeviceStore delegate) {
        this.delegate = delegate;
    }

    public FlakyDeviceStore failNextReads(int count, boolean transientFailure) {
        this.failures.set(count);
        this.transientFailure = transientFailure;
        return this;
    }

    public FlakyDeviceStore failWrites(boolean failWrites) {
        this.failWrites = failWrites;
        return this;
    }

    public int readCalls() {
        return readCalls.get();
    }

    @Override
    public boolean insertDevice(String deviceId,
                                String userId,
                                String derivedKeyHash,
                                byte[] encryptedSecret,
                                Instant createdAt) {
        checkWrite("insertDevice");
        return delegate.insertDevice(deviceId, userId, derivedKeyHash, encryptedSecret, createdAt);
    }

    @Override
    public Optional<DeviceRow> findDevice(String deviceId) {
        checkRead("findDevice");
        return delegate.findDevice(deviceId);
    }

    @Override
    public List<DeviceRow> listDevicesByUser(String userId) {
        checkRead("listDevicesByUser");
        return delegate.listDevicesByUser(userId);
    }

    @Override
    public boolean markVerified(String deviceId, long movingFactor, Instant usedAt) {
        checkWrite("markVerified");
        return delegate.markVerified(deviceId, movingFactor, usedAt);
    }

    @Override
    public boolean deactivate(String deviceId, Instant deactivatedAt) {
        checkWrite("deactivate");
        return delegate.deactivate(deviceId, deactivatedAt);
    }

    @Override
    public boolean ping() {
        return !failWrites && failures.get() == 0;
    }

    private void checkRead(String operation) {
        readCalls.incrementAndGet();
        if (failures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException(operation, transientFailure, new RuntimeException("connection reset"));
        }
    }

    private void checkWrite(String operation) {
        if (failWrites) {
            throw new StorageException(operation, false, new RuntimeException("disk full"));
        }
    }
}
