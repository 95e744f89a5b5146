package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.TimelineEvent;

import java.time.Instant;
import java.util.List;

public interface TimelineProvider {
    /** Events with from <= timestamp <= to; a null bound is open. */
    List<TimelineEvent> findByOwner(String ownerId, Instant from, Instant to);
}
