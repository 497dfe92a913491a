package com.eyegaze.heatmapapi.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record ModelUploadRequest(
    @JsonProperty("model_name") @NotBlank @Size(max = 128) String modelName,
    @JsonProperty("user_id") @NotNull @Positive Long userId,
    @JsonProperty("image_base64") @NotBlank String imageBase64
) {}
