package com.eyegaze.heatmapapi.models;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModelRecordRepository extends JpaRepository<ModelRecord, Long> {

  List<ModelRecord> findAllByOrderByCreatedAtDescIdDesc();

  boolean existsByModelName(String modelName);
}
