package com.flaretrack.insights.repository;

import com.flaretrack.insights.domain.DomainModels.CorrelationCategory;
import com.flaretrack.insights.domain.DomainModels.CorrelationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Repository
public class CorrelationJdbcRepository implements CorrelationProvider {
    private static final Logger log = LoggerFactory.getLogger(CorrelationJdbcRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public CorrelationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CorrelationRecord> findByOwner(String ownerId, Instant from, Instant to) {
        return jdbcTemplate.query(
                        "SELECT id, item1, item2, category, coefficient, lag_hours, confidence, window_start, window_end " +
                                "FROM correlations WHERE owner_id = ? ORDER BY id",
                        (rs, n) -> toRecord(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                                rs.getDouble(5), rs.getDouble(6), rs.getString(7),
                                parse(rs.getString(8)), parse(rs.getString(9))),
                        ownerId)
                .stream()
                .filter(Objects::nonNull)
                .filter(c -> overlaps(c, from, to))
                .toList();
    }

    private CorrelationRecord toRecord(String id, String item1, String item2, String category, double coefficient,
                                       double lagHours, String confidence, Instant windowStart, Instant windowEnd) {
        CorrelationCategory parsed = CorrelationCategory.fromCode(category);
        if (parsed == null) {
            log.debug("Skipping correlation {} with unknown category '{}'", id, category);
            return null;
        }
        return new CorrelationRecord(id, item1, item2, parsed, coefficient, lagHours, confidence, windowStart, windowEnd);
    }

    private boolean overlaps(CorrelationRecord c, Instant from, Instant to) {
        if (from != null && c.windowEnd() != null && c.windowEnd().isBefore(from)) return false;
        return to == null || c.windowStart() == null || !c.windowStart().isAfter(to);
    }

    private static Instant parse(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
