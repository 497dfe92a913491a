package com.eyegaze.heatmapapi.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelCreatedResponse(
    String status,
    @JsonProperty("model_id") long modelId,
    int width,
    int height
) {}
