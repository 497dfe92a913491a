package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HeatmapCreatedResponse(
    String status,
    @JsonProperty("point_count") int pointCount,
    @JsonProperty("session_id") long sessionId
) {}
