package com.baykanat.calendar.infrastructure.persistence;

import com.baykanat.calendar.domain.model.Month;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** months tablosu: sayfalı okuma, tekil okuma, insert/update/delete. Event'ler ayrıca yüklenir. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MonthJdbcRepository {

    private static final RowMapper<Month> ROW_MAPPER = (rs, rowNum) -> Month.builder()
            .id(rs.getLong("id"))
            .monthBn(rs.getString("month_bn"))
            .monthEn(rs.getString("month_en"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /** Ekleme sırasına göre (id artan) offset/limit ile ay listesi. */
    public List<Month> findPage(int skip, int limit) {
        String sql = """
                SELECT id, month_bn, month_en
                FROM months
                ORDER BY id
                LIMIT ? OFFSET ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, limit, skip);
    }

    public Optional<Month> findById(long id) {
        String sql = "SELECT id, month_bn, month_en FROM months WHERE id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, id).stream().findFirst();
    }

    /** Yeni ay ekler, üretilen id'yi döner. */
    public long insert(String monthBn, String monthEn) {
        String sql = "INSERT INTO months (month_bn, month_en) VALUES (?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, monthBn);
            ps.setString(2, monthEn);
            return ps;
        }, keyHolder);
        return Objects.requireNonNull(keyHolder.getKey(), "generated month id").longValue();
    }

    /** İki isim alanını birlikte günceller; etkilenen satır sayısı. */
    public int update(long id, String monthBn, String monthEn) {
        return jdbcTemplate.update("UPDATE months SET month_bn = ?, month_en = ? WHERE id = ?",
                monthBn, monthEn, id);
    }

    /** Ayı siler; events ve event_details FK ON DELETE CASCADE ile gider. */
    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM months WHERE id = ?", id);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM months", Long.class);
        return count != null ? count : 0L;
    }
}
