package com.eyegaze.heatmapapi.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** A reference image ("model") that heatmaps are rendered over. */
@Entity
@Table(name = "models")
public class ModelRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "model_name", nullable = false)
  private String modelName;

  @Column(name = "model_path", nullable = false)
  private String modelPath;

  @Column(name = "user_id", nullable = false)
  private long userId;

  @Column(nullable = false)
  private int width;

  @Column(nullable = false)
  private int height;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public ModelRecord() {
    // JPA default constructor
  }

  public ModelRecord(String modelName, String modelPath, long userId, int width, int height,
      Instant createdAt) {
    this.modelName = modelName;
    this.modelPath = modelPath;
    this.userId = userId;
    this.width = width;
    this.height = height;
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public String getModelName() {
    return modelName;
  }

  public String getModelPath() {
    return modelPath;
  }

  public long getUserId() {
    return userId;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
