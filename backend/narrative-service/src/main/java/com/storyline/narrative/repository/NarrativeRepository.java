package com.storyline.narrative.repository;

import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Narrative;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NarrativeRepository extends JpaRepository<Narrative, Long> {

    Optional<Narrative> findByCreationKey(String creationKey);

    List<Narrative> findByLastUpdatedGreaterThanEqual(LocalDateTime since);

    List<Narrative> findByLifecycleStateAndLastUpdatedGreaterThanEqual(LifecycleState state, LocalDateTime since);

    List<Narrative> findByLifecycleStateInOrderByLastUpdatedDesc(Collection<LifecycleState> states, Pageable pageable);

    List<Narrative> findByLifecycleStateAndLastUpdatedGreaterThanEqualOrderByLastUpdatedDesc(
            LifecycleState state, LocalDateTime since, Pageable pageable);

    List<Narrative> findByReawakeningCountGreaterThanAndLastUpdatedGreaterThanEqualOrderByLastUpdatedDesc(
            int minCount, LocalDateTime since, Pageable pageable);

}
