package com.baykanat.calendar.infrastructure.persistence;

import com.baykanat.calendar.domain.model.EventDetail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** event_details tablosu: toplu okuma, metin araması, batch insert, delete. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventDetailJdbcRepository {

    private static final RowMapper<EventDetail> ROW_MAPPER = (rs, rowNum) -> EventDetail.builder()
            .id(rs.getLong("id"))
            .eventId(rs.getLong("event_id"))
            .detail(rs.getString("detail"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /** Verilen event'lerin detayları, id sırasıyla. */
    public List<EventDetail> findByEventIds(Collection<Long> eventIds) {
        if (eventIds.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(",", eventIds.stream().map(id -> "?").toList());
        String sql = "SELECT id, event_id, detail FROM event_details WHERE event_id IN (" + placeholders + ") ORDER BY id";

        return jdbcTemplate.query(sql, ROW_MAPPER, eventIds.toArray());
    }

    public Optional<EventDetail> findById(long id) {
        String sql = "SELECT id, event_id, detail FROM event_details WHERE id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, id).stream().findFirst();
    }

    /** Büyük/küçük harf duyarsız içerik araması; pattern LIKE joker karakterlerini içermeli. */
    public List<EventDetail> searchByPattern(String likePattern) {
        String sql = """
                SELECT id, event_id, detail
                FROM event_details
                WHERE detail ILIKE ? ESCAPE '\\'
                ORDER BY id
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, likePattern);
    }

    /** Tek detay ekler, üretilen id'yi döner. */
    public long insert(long eventId, String detail) {
        String sql = "INSERT INTO event_details (event_id, detail) VALUES (?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, eventId);
            ps.setString(2, detail);
            return ps;
        }, keyHolder);
        return Objects.requireNonNull(keyHolder.getKey(), "generated detail id").longValue();
    }

    /** Bir event'in detaylarını batch insert eder. */
    public void batchInsert(long eventId, List<String> details) {
        if (details.isEmpty()) {
            return;
        }

        String sql = "INSERT INTO event_details (event_id, detail) VALUES (?, ?)";
        jdbcTemplate.batchUpdate(sql, details, details.size(),
                (ps, detail) -> {
                    ps.setLong(1, eventId);
                    ps.setString(2, detail);
                });
    }

    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM event_details WHERE id = ?", id);
    }
}
