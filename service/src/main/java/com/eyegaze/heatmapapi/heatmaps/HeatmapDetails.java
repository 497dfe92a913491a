package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeatmapDetails(
    long id,
    @JsonProperty("img_name") String imgName,
    @JsonProperty("model_id") Long modelId,
    @JsonProperty("user_id") long userId,
    @JsonProperty("point_count") int pointCount,
    @JsonProperty("created_at") Instant createdAt
) {

  static HeatmapDetails of(HeatmapRecord record) {
    return new HeatmapDetails(record.getId(), record.getImgName(), record.getModelId(),
        record.getUserId(), record.getPointCount(), record.getCreatedAt());
  }
}
