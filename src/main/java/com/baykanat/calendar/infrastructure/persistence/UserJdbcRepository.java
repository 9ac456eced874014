package com.baykanat.calendar.infrastructure.persistence;

import com.baykanat.calendar.domain.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.Objects;
import java.util.Optional;

/** users tablosu. username UNIQUE; çakışmada DuplicateKeyException yukarı fırlar. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class UserJdbcRepository {

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> User.builder()
            .id(rs.getLong("id"))
            .username(rs.getString("username"))
            .passwordHash(rs.getString("password_hash"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<User> findByUsername(String username) {
        String sql = "SELECT id, username, password_hash FROM users WHERE username = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, username).stream().findFirst();
    }

    /** Yeni kullanıcı ekler ve id'si atanmış hali döner. */
    public User insert(String username, String passwordHash) {
        String sql = "INSERT INTO users (username, password_hash) VALUES (?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, username);
            ps.setString(2, passwordHash);
            return ps;
        }, keyHolder);
        return User.builder()
                .id(Objects.requireNonNull(keyHolder.getKey(), "generated user id").longValue())
                .username(username)
                .passwordHash(passwordHash)
                .build();
    }

    /** Parola hash'ini günceller; etkilenen satır sayısı. */
    public int updatePasswordHash(String username, String passwordHash) {
        return jdbcTemplate.update("UPDATE users SET password_hash = ? WHERE username = ?", passwordHash, username);
    }
}
