package com.eyegaze.heatmapapi.heatmaps;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface HeatmapRecordRepository extends JpaRepository<HeatmapRecord, Long> {

  List<HeatmapRecord> findByUserIdOrderByCreatedAtDescIdDesc(long userId);

  boolean existsByUserIdAndImgName(long userId, String imgName);
}
