package com.eyegaze.heatmapapi.heatmaps;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"id", "img_name", "created_at"})
public record HeatmapSummary(
    long id,
    @JsonProperty("img_name") String imgName,
    @JsonProperty("created_at") Instant createdAt
) {

  static HeatmapSummary of(HeatmapRecord record) {
    return new HeatmapSummary(record.getId(), record.getImgName(), record.getCreatedAt());
  }
}
