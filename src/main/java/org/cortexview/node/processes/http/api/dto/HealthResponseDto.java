package org.cortexview.node.processes.http.api.dto;

import java.util.Map;

/**
 * Body of {@code GET /health}.
 *
 * @param status        Always {@code "ok"} while the process is alive.
 * @param service       The service name.
 * @param uptimeSeconds Seconds since the observatory was created.
 * @param observers     Number of connected push observers.
 * @param sources       Freshness per source, {@code "fresh"} or {@code "stale"}.
 */
public record HealthResponseDto(
    String status,
    String service,
    long uptimeSeconds,
    int observers,
    Map<String, String> sources
) {
}
