package com.storyline.narrative.store;

import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeMergeRecord;
import com.storyline.narrative.entity.SummaryUpdateReason;
import com.storyline.narrative.exception.DuplicateNarrativeException;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary of the narrative engine.
 *
 * Every write validates the narrative first. Writes that touch more than one record
 * (linking articles, absorbing a duplicate) are atomic.
 */
public interface NarrativeStore {

    Optional<Narrative> findById(Long id);

    Optional<Narrative> findByCreationKey(String creationKey);

    boolean exists(Long id);

    List<Narrative> findAll();

    /**
     * Narratives whose lastUpdated is at or after {@code since}.
     */
    List<Narrative> findUpdatedSince(LocalDateTime since);

    List<Narrative> findDormantUpdatedSince(LocalDateTime since);

    /**
     * Inserts a new narrative and links its articles.
     *
     * @throws DuplicateNarrativeException when another narrative holds the same creation key
     */
    Narrative create(Narrative narrative);

    /**
     * Saves an extended narrative, links the added articles and queues a summary refresh.
     */
    Narrative extend(Narrative narrative, Collection<String> addedArticleIds);

    /**
     * Saves {@code primary} (already carrying the union), re-links the articles of
     * {@code absorbed}, deletes it and records the merge. All or nothing.
     */
    Narrative absorb(Narrative primary, Narrative absorbed, double similarity, MergeTrigger trigger);

    /**
     * Plain update (lifecycle, summary text, integrity repair).
     */
    Narrative save(Narrative narrative);

    void requestSummaryUpdate(Long narrativeId, SummaryUpdateReason reason);

    List<Narrative> findByStates(Set<LifecycleState> states, int limit);

    List<Narrative> findByStateUpdatedSince(LifecycleState state, LocalDateTime since, int limit);

    List<Narrative> findReawakenedSince(LocalDateTime since, int limit);

    List<NarrativeMergeRecord> findMergeHistory(Long primaryId);
}
