package com.storyline.narrative.service.cluster;

import com.storyline.narrative.entity.ArticleRecord;

import java.util.List;

/**
 * Output of one clustering pass: the clusters and the articles that could not join any.
 */
public record ClusterBuildResult(List<ArticleCluster> clusters, List<ArticleRecord> excluded) {
}
