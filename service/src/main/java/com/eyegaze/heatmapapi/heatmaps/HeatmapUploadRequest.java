package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

public record HeatmapUploadRequest(
    @NotBlank @Size(max = 128) String name,
    @JsonProperty("user_id") @NotNull @Positive Long userId,
    @JsonProperty("model_id") Long modelId,
    int width,
    int height,
    @NotNull List<@NotNull GazePointRequest> points,
    @JsonProperty("background_base64") String backgroundBase64,
    @JsonProperty("fit_background") boolean fitBackground
) {

  RenderRequest toRenderRequest() {
    return new RenderRequest(width, height, points, backgroundBase64, fitBackground);
  }
}
