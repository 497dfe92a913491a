package com.eyegaze.heatmapapi.heatmaps;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "heatmaps")
public class HeatmapRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "img_name", nullable = false)
  private String imgName;

  // Store reference, relative to the storage root.
  @Column(name = "image_path", nullable = false)
  private String imagePath;

  @Column(name = "model_id")
  private Long modelId;

  @Column(name = "user_id", nullable = false)
  private long userId;

  @Column(name = "point_count", nullable = false)
  private int pointCount;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public HeatmapRecord() {
    // JPA default constructor
  }

  public HeatmapRecord(String imgName, String imagePath, Long modelId, long userId,
      int pointCount, Instant createdAt) {
    this.imgName = imgName;
    this.imagePath = imagePath;
    this.modelId = modelId;
    this.userId = userId;
    this.pointCount = pointCount;
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public String getImgName() {
    return imgName;
  }

  public String getImagePath() {
    return imagePath;
  }

  public Long getModelId() {
    return modelId;
  }

  public long getUserId() {
    return userId;
  }

  public int getPointCount() {
    return pointCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
