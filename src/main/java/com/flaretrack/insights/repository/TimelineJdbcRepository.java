package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.TimelineCategory;
import com.flaretrack.insights.domain.DomainModels.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Repository
public class TimelineJdbcRepository implements TimelineProvider {
    private static final Logger log = LoggerFactory.getLogger(TimelineJdbcRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public TimelineJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<TimelineEvent> findByOwner(String ownerId, Instant from, Instant to) {
        return jdbcTemplate.query(
                        "SELECT id, category, ts, summary FROM timeline_events WHERE owner_id = ?",
                        (rs, n) -> toEvent(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3)), rs.getString(4)),
                        ownerId)
                .stream()
                .filter(Objects::nonNull)
                .filter(e -> from == null || !e.timestamp().isBefore(from))
                .filter(e -> to == null || !e.timestamp().isAfter(to))
                .sorted(Comparator.comparing(TimelineEvent::timestamp))
                .toList();
    }

    private TimelineEvent toEvent(String id, String category, Instant ts, String summary) {
        TimelineCategory parsed = TimelineCategory.fromCode(category);
        if (parsed == null) {
            log.debug("Skipping timeline event {} with unknown category '{}'", id, category);
            return null;
        }
        return new TimelineEvent(id, parsed, ts, summary);
    }
}
