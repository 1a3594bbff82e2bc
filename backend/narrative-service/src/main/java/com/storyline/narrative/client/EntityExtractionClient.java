package com.storyline.narrative.client;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractionResult;
import reactor.core.publisher.Mono;

/**
 * External entity extraction collaborator.
 *
 * Implementations signal a rate limit with
 * {@link com.storyline.narrative.exception.ExtractionException#isRateLimited()}.
 */
public interface EntityExtractionClient {

    Mono<ExtractionResult> extract(ArticleRecord article);
}
