package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels;
import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class EpisodeJdbcRepository implements EpisodeStore {
    private static final String SELECT = "SELECT id, owner_id, body_region, start_ts, end_ts, status, initial_severity FROM episodes";

    private static final RowMapper<Episode> MAPPER = (rs, n) -> new Episode(
            rs.getString(1), rs.getString(2), rs.getString(3),
            Instant.parse(rs.getString(4)),
            rs.getString(5) == null ? null : Instant.parse(rs.getString(5)),
            DomainModels.EpisodeStatus.fromCode(rs.getString(6)),
            rs.getInt(7));

    private final JdbcTemplate jdbcTemplate;

    public EpisodeJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Episode> findByOwner(String ownerId) {
        return jdbcTemplate.query(SELECT + " WHERE owner_id = ? ORDER BY start_ts, id", MAPPER, ownerId);
    }

    @Override
    public List<Episode> findByOwnerAndRegion(String ownerId, String bodyRegion) {
        return jdbcTemplate.query(SELECT + " WHERE owner_id = ? AND body_region = ? ORDER BY start_ts, id", MAPPER,
                ownerId, bodyRegion);
    }

    @Override
    public List<Episode> findByOwnerAndStatus(String ownerId, EpisodeStatus status) {
        return jdbcTemplate.query(SELECT + " WHERE owner_id = ? AND LOWER(status) = ? ORDER BY start_ts, id", MAPPER,
                ownerId, status.code());
    }
}
