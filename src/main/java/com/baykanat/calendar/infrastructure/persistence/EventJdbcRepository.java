package com.baykanat.calendar.infrastructure.persistence;

import com.baykanat.calendar.domain.model.Event;
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

/** events tablosu: ay bazlı toplu okuma, gün eşleşmesi, insert/delete. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventJdbcRepository {

    private static final RowMapper<Event> ROW_MAPPER = (rs, rowNum) -> Event.builder()
            .id(rs.getLong("id"))
            .monthId(rs.getLong("month_id"))
            .day(rs.getString("day"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /** Verilen ayların event'leri, id sırasıyla. */
    public List<Event> findByMonthIds(Collection<Long> monthIds) {
        if (monthIds.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(",", monthIds.stream().map(id -> "?").toList());
        String sql = "SELECT id, month_id, day FROM events WHERE month_id IN (" + placeholders + ") ORDER BY id";

        return jdbcTemplate.query(sql, ROW_MAPPER, monthIds.toArray());
    }

    /** Ay içinde day değeri birebir eşleşen event'ler. */
    public List<Event> findByMonthIdAndDay(long monthId, String day) {
        String sql = "SELECT id, month_id, day FROM events WHERE month_id = ? AND day = ? ORDER BY id";
        return jdbcTemplate.query(sql, ROW_MAPPER, monthId, day);
    }

    public Optional<Event> findById(long id) {
        String sql = "SELECT id, month_id, day FROM events WHERE id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, id).stream().findFirst();
    }

    /** Yeni event ekler, üretilen id'yi döner. */
    public long insert(long monthId, String day) {
        String sql = "INSERT INTO events (month_id, day) VALUES (?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, monthId);
            ps.setString(2, day);
            return ps;
        }, keyHolder);
        return Objects.requireNonNull(keyHolder.getKey(), "generated event id").longValue();
    }

    /** Event'i siler; detaylar FK ON DELETE CASCADE ile gider. */
    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM events WHERE id = ?", id);
    }
}
