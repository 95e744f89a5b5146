package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;

import java.util.List;

public interface EventLogStore {
    List<EpisodeEvent> findByEpisodeId(String episodeId);
}
