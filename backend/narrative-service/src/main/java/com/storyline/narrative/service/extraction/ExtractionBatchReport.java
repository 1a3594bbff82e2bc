package com.storyline.narrative.service.extraction;

public record ExtractionBatchReport(int attempted, int extracted, int failed) {

    public static ExtractionBatchReport empty() {
        return new ExtractionBatchReport(0, 0, 0);
    }
}
