package com.storyline.narrative.repository;

import com.storyline.narrative.entity.NarrativeMergeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NarrativeMergeRecordRepository extends JpaRepository<NarrativeMergeRecord, Long> {

    List<NarrativeMergeRecord> findByPrimaryNarrativeIdOrderByMergedAtDesc(Long primaryNarrativeId);
}
