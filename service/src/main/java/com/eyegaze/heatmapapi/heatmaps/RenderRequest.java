package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record RenderRequest(
    int width,
    int height,
    @NotNull List<@NotNull GazePointRequest> points,
    @JsonProperty("background_base64") String backgroundBase64,
    @JsonProperty("fit_background") boolean fitBackground
) {}
