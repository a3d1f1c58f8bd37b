package io.github.drompincen.simgate.protocol.api;

import java.time.Instant;

public record SessionSummaryDto(
        String sessionId,
        String casePath,
        Instant createdAt,
        Instant lastAccessedAt
) {}
