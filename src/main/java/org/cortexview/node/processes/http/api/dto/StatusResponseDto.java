package org.cortexview.node.processes.http.api.dto;

/**
 * Minimal status body, used for the "not yet initialized" answer.
 */
public record StatusResponseDto(String status) {

    public static final StatusResponseDto INITIALIZING = new StatusResponseDto("initializing");
}
