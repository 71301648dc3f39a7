package com.deviceotp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.deviceotp.FlakyDeviceStore;
import com.deviceotp.InMemoryStorage;
import com.deviceotp.MutableClock;
import com.deviceotp.TestAppConfig;
import com.deviceotp.dao.StorageException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeviceRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final InMemoryStorage storage = new InMemoryStorage();
    private final DeviceRegistry registry = new DeviceRegistry(storage, TestAppConfig.dbConfig(2), clock);

    @Test
    void registerCreatesActiveDeviceWithZeroUsage() {
        var row = registry.register("D1", "u1", "hash", new byte[] {1, 2, 3});

        assertThat(row.active()).isTrue();
        assertThat(row.usageCount()).isZero();
        assertThat(row.lastUsed()).isNull();
        assertThat(registry.load("D1").createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void registerRejectsDuplicateEvenWhenInactive() {
        registry.register("D1", "u1", "hash", new byte[] {1});
        registry.deactivate("D1");

        assertThatThrownBy(() -> registry.register("D1", "u2", "other", new byte[] {2}))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.status()).isEqualTo(409);
                assertThat(e.publicMessage()).isEqualTo("duplicate_device");
            });
        assertThat(registry.load("D1").userId()).isEqualTo("u1");
    }

    @Test
    void deactivateIsOneWay() {
        registry.register("D1", "u1", "hash", new byte[] {1});
        clock.advance(Duration.ofMinutes(5));

        Instant at = registry.deactivate("D1");

        assertThat(at).isEqualTo(clock.instant());
        assertThat(registry.load("D1").active()).isFalse();
        assertThat(registry.load("D1").deactivatedAt()).isEqualTo(at);
        assertThatThrownBy(() -> registry.deactivate("D1"))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.publicMessage()).isEqualTo("already_inactive"));
        assertThatThrownBy(() -> registry.deactivate("missing"))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.status()).isEqualTo(404));
    }

    @Test
    void recordSuccessfulVerificationRefusesConsumedFactor() {
        registry.register("D1", "u1", "hash", new byte[] {1});

        registry.recordSuccessfulVerification("D1", 100, clock.instant());

        assertThatThrownBy(() -> registry.recordSuccessfulVerification("D1", 100, clock.instant()))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.publicMessage()).isEqualTo("replay_detected"));
        assertThatThrownBy(() -> registry.recordSuccessfulVerification("D1", 99, clock.instant()))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.publicMessage()).isEqualTo("replay_detected"));

        var row = registry.load("D1");
        assertThat(row.usageCount()).isEqualTo(1);
        assertThat(row.lastMovingFactor()).isEqualTo(100L);
    }

    @Test
    void recordSuccessfulVerificationLosesToDeactivation() {
        registry.register("D1", "u1", "hash", new byte[] {1});
        registry.deactivate("D1");

        assertThatThrownBy(() -> registry.recordSuccessfulVerification("D1", 1, clock.instant()))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.status()).isEqualTo(403);
                assertThat(e.publicMessage()).isEqualTo("device_inactive");
            });
        assertThatThrownBy(() -> registry.recordSuccessfulVerification("ghost", 1, clock.instant()))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.status()).isEqualTo(404));
        assertThat(registry.load("D1").usageCount()).isZero();
    }

    @Test
    void lastUsedNeverMovesBackwards() {
        registry.register("D1", "u1", "hash", new byte[] {1});
        Instant later = clock.instant().plusSeconds(60);

        registry.recordSuccessfulVerification("D1", 10, later);
        registry.recordSuccessfulVerification("D1", 11, clock.instant());

        assertThat(registry.load("D1").lastUsed()).isEqualTo(later);
    }

    @Test
    void transientReadFailuresAreRetried() {
        var flaky = new FlakyDeviceStore(storage);
        var retrying = new DeviceRegistry(flaky, TestAppConfig.dbConfig(2), clock);
        registry.register("D1", "u1", "hash", new byte[] {1});

        flaky.failNextReads(2, true);

        assertThat(retrying.find("D1")).isPresent();
        assertThat(flaky.readCalls()).isEqualTo(3);
    }

    @Test
    void readFailsWhenRetriesAreExhausted() {
        var flaky = new FlakyDeviceStore(storage).failNextReads(3, true);
        var retrying = new DeviceRegistry(flaky, TestAppConfig.dbConfig(2), clock);

        assertThatThrownBy(() -> retrying.find("D1"))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.status()).isEqualTo(503);
                assertThat(e.publicMessage()).isEqualTo("storage_unavailable");
                assertThat(e.getCause()).isInstanceOf(StorageException.class);
            });
        assertThat(flaky.readCalls()).isEqualTo(3);
    }

    @Test
    void zeroReadRetriesMeansSingleAttempt() {
        var flaky = new FlakyDeviceStore(storage).failNextReads(1, true);
        var noRetry = new DeviceRegistry(flaky, TestAppConfig.dbConfig(0), clock);

        assertThatThrownBy(() -> noRetry.find("D1")).isInstanceOf(ApiException.class);
        assertThat(flaky.readCalls()).isEqualTo(1);
    }

    @Test
    void permanentReadFailureIsNotRetried() {
        var flaky = new FlakyDeviceStore(storage).failNextReads(1, false);
        var retrying = new DeviceRegistry(flaky, TestAppConfig.dbConfig(2), clock);

        assertThatThrownBy(() -> retrying.listByUser("u1")).isInstanceOf(ApiException.class);
        assertThat(flaky.readCalls()).isEqualTo(1);
    }

    @Test
    void writeFailureIsNeverRetried() {
        var flaky = new FlakyDeviceStore(storage).failWrites(true);
        var failing = new DeviceRegistry(flaky, TestAppConfig.dbConfig(2), clock);

        assertThatThrownBy(() -> failing.register("D1", "u1", "hash", new byte[] {1}))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.status()).isEqualTo(503));
        assertThat(storage.findDevice("D1")).isEmpty();
    }
}
