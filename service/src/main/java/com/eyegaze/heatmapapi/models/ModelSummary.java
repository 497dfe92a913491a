package com.eyegaze.heatmapapi.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"id", "model_name", "width", "height", "user_id", "created_at"})
public record ModelSummary(
    long id,
    @JsonProperty("model_name") String modelName,
    int width,
    int height,
    @JsonProperty("user_id") long userId,
    @JsonProperty("created_at") Instant createdAt
) {

  static ModelSummary of(ModelRecord record) {
    return new ModelSummary(record.getId(), record.getModelName(), record.getWidth(),
        record.getHeight(), record.getUserId(), record.getCreatedAt());
  }
}
