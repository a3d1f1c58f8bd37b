package io.github.drompincen.simgate.protocol.api;

import java.util.List;

public record ServerInfoDto(
        String name,
        String version,
        int maxSessions,
        long sessionTimeoutSeconds,
        String casesDir,
        List<String> tools
) {}
