package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeStatus;

import java.util.List;

public interface EpisodeStore {
    List<Episode> findByOwner(String ownerId);

    List<Episode> findByOwnerAndRegion(String ownerId, String bodyRegion);

    List<Episode> findByOwnerAndStatus(String ownerId, EpisodeStatus status);
}
