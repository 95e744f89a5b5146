package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;
import com.flaretrack.insights.domain.DomainModels.EpisodeTrend;
import com.flaretrack.insights.domain.DomainModels.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Repository
public class EpisodeEventJdbcRepository implements EventLogStore {
    private static final Logger log = LoggerFactory.getLogger(EpisodeEventJdbcRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public EpisodeEventJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<EpisodeEvent> findByEpisodeId(String episodeId) {
        List<EventRow> rows = jdbcTemplate.query(
                "SELECT id, episode_id, ts, event_kind, severity, trend, intervention_category, intervention_detail, notes " +
                        "FROM episode_events WHERE episode_id = ?",
                (rs, n) -> new EventRow(
                        rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3)), rs.getString(4),
                        (Double) rs.getObject(5), rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9)),
                episodeId);

        return rows.stream()
                .map(this::toEvent)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(EpisodeEvent::timestamp))
                .toList();
    }

    private EpisodeEvent toEvent(EventRow row) {
        EventKind kind = EventKind.fromCode(row.kind());
        if (kind == null) {
            log.debug("Skipping event {} with unknown kind '{}'", row.id(), row.kind());
            return null;
        }
        return new EpisodeEvent(row.id(), row.episodeId(), row.ts(), kind, row.severity(),
                EpisodeTrend.fromCode(row.trend()), row.interventionCategory(), row.interventionDetail(), row.notes());
    }

    private record EventRow(String id, String episodeId, Instant ts, String kind, Double severity, String trend,
                            String interventionCategory, String interventionDetail, String notes) {}
}
