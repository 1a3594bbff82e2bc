package com.storyline.narrative.mapper;

import com.storyline.narrative.dto.FingerprintDto;
import com.storyline.narrative.dto.LifecycleTransitionDto;
import com.storyline.narrative.dto.MergeRecordDto;
import com.storyline.narrative.dto.NarrativeDetailDto;
import com.storyline.narrative.dto.NarrativeSummaryDto;
import com.storyline.narrative.entity.LifecycleTransition;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.entity.NarrativeMergeRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

@Component
public class NarrativeMapper {

    public NarrativeSummaryDto toSummaryDto(Narrative narrative) {
        return new NarrativeSummaryDto(
                narrative.getId(),
                narrative.getTitle(),
                narrative.getSummary(),
                narrative.getLifecycleState(),
                narrative.getArticleCount(),
                narrative.getMentionVelocity(),
                narrative.getMomentum(),
                narrative.getFirstSeen(),
                narrative.getLastUpdated(),
                narrative.getReawakeningCount(),
                narrative.getResurrectionVelocity()
        );
    }

    public NarrativeDetailDto toDetailDto(Narrative narrative, List<NarrativeMergeRecord> mergeHistory) {
        return new NarrativeDetailDto(
                narrative.getId(),
                narrative.getTitle(),
                narrative.getSummary(),
                narrative.getLifecycleState(),
                narrative.getArticleCount(),
                narrative.getMentionVelocity(),
                narrative.getMomentum(),
                narrative.getFirstSeen(),
                narrative.getLastUpdated(),
                narrative.getReawakeningCount(),
                narrative.getResurrectionVelocity(),
                narrative.getDormantSince(),
                narrative.getReawakenedFrom(),
                narrative.isNeedsSummaryUpdate(),
                toDto(narrative.getFingerprint()),
                new LinkedHashMap<>(narrative.getEntitySalience()),
                new ArrayList<>(narrative.getArticleIds()),
                narrative.getLifecycleHistory().stream().map(this::toDto).toList(),
                List.copyOf(narrative.getMergedFrom()),
                narrative.getMergedAt(),
                mergeHistory.stream().map(this::toDto).toList()
        );
    }

    public FingerprintDto toDto(NarrativeFingerprint fingerprint) {
        return new FingerprintDto(
                fingerprint.getNucleusEntity(),
                new LinkedHashMap<>(fingerprint.getTopActors()),
                List.copyOf(fingerprint.getKeyActions()),
                fingerprint.getComputedAt()
        );
    }

    public LifecycleTransitionDto toDto(LifecycleTransition transition) {
        return new LifecycleTransitionDto(
                transition.getState(),
                transition.getTimestamp(),
                transition.getArticleCount(),
                transition.getMentionVelocity()
        );
    }

    public MergeRecordDto toDto(NarrativeMergeRecord record) {
        return new MergeRecordDto(
                record.getMergedNarrativeId(),
                record.getMergedTitle(),
                record.getMergedNucleus(),
                record.getMergedArticleCount(),
                record.getSimilarity(),
                record.getTrigger(),
                record.getMergedAt()
        );
    }
}
