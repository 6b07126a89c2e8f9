package com.shardfeed.feed.config;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.shardfeed.feed.service.feed.ScoringWeights;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;

@Singleton
public final class RankingConfig {
    private final int candidateWindow;
    private final int pageSize;
    private final int maxFailedFollowees;
    private final ScoringWeights weights;

    @Inject
    public RankingConfig(Config config) {
        Config ranking = config.getConfig("ranking");
        this.candidateWindow = ConfigurationException.requirePositive("ranking.candidate-window",
                                                                      ranking.getInt("candidate-window"));
        this.pageSize = ConfigurationException.requirePositive("ranking.page-size",
                                                               ranking.getInt("page-size"));
        this.maxFailedFollowees = ranking.getInt("max-failed-followees");
        if (maxFailedFollowees < 0) {
            throw new ConfigurationException("ranking.max-failed-followees must be >= 0, got: " + maxFailedFollowees);
        }
        this.weights = new ScoringWeights(
            ranking.getDouble("weights.likes"),
            ranking.getDouble("weights.shares"),
            ranking.getDouble("weights.comments")
        );
    }

    public int getCandidateWindow() {
        return candidateWindow;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getMaxFailedFollowees() {
        return maxFailedFollowees;
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
