package com.deviceotp.controller;

import com.deviceotp.dao.DeviceStore;
import com.deviceotp.domain.DeviceApi;
import com.deviceotp.util.HttpResponseFactory;
import java.time.Clock;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;

/**
 * Liveness only, always 200. The database field reports a {@code SELECT 1} probe.
 */
@Component
@HttpController
public final class HealthController {
    static final String VERSION = "1.0.0";

    private final DeviceStore deviceStore;
    private final HttpResponseFactory responses;
    private final Clock clock;

    public HealthController(DeviceStore deviceStore, HttpResponseFactory responses, Clock clock) {
        this.deviceStore = deviceStore;
        this.responses = responses;
        this.clock = clock;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/health")
    public HttpServerResponse health() {
        String database = deviceStore.ping() ? "healthy" : "unhealthy";
        return responses.json(200, new DeviceApi.HealthResponse(
            "healthy".equals(database) ? "healthy" : "degraded",
            clock.instant(),
            VERSION,
            database
        ));
    }
}
