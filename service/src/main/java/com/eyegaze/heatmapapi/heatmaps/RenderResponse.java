package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RenderResponse(
    int width,
    int height,
    @JsonProperty("point_count") int pointCount,
    @JsonProperty("image_base64") String imageBase64
) {}
