package com.storyline.narrative.repository;

import com.storyline.narrative.entity.SummaryTaskStatus;
import com.storyline.narrative.entity.SummaryUpdateTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SummaryUpdateTaskRepository extends JpaRepository<SummaryUpdateTask, Long> {

    boolean existsByNarrativeIdAndStatus(Long narrativeId, SummaryTaskStatus status);

    List<SummaryUpdateTask> findByStatusOrderByCreatedAtAsc(SummaryTaskStatus status, Pageable pageable);
}
