package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.CorrelationRecord;

import java.time.Instant;
import java.util.List;

public interface CorrelationProvider {
    /** Records whose covering window overlaps [from, to]; a null bound is open. */
    List<CorrelationRecord> findByOwner(String ownerId, Instant from, Instant to);
}
