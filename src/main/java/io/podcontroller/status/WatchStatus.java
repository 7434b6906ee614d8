package io.podcontroller.status;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Point-in-time health of one watch loop.
 */
@Data
@AllArgsConstructor
public class WatchStatus {
    private final String watchName;
    private final int consecutiveErrors;
    private final String lastError;
    private final Instant lastErrorAt;
    private final Instant lastSuccessAt;

    public boolean isHealthy() {
        return consecutiveErrors == 0;
    }
}
