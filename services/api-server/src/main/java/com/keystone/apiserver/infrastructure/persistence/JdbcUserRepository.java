package com.keystone.apiserver.infrastructure.persistence;

import com.keystone.apiserver.domain.User;
import com.keystone.apiserver.domain.UserDetails;
import com.keystone.apiserver.domain.UserRepository;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * {@link UserRepository} on the {@code users} table created by {@code V1__create_users_table.sql}.
 */
@Repository
public class JdbcUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserRepository.class);

    private static final String COLUMNS =
            "id, first_name, last_name, email, created_at, updated_at";

    private static final RowMapper<User> USER_ROW_MAPPER = JdbcUserRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<User> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users ORDER BY id", USER_ROW_MAPPER);
    }

    @Override
    public Optional<User> findById(long id) {
        List<User> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM users WHERE id = ?", USER_ROW_MAPPER, id);
        return rows.stream().findFirst();
    }

    @Override
    public User insert(UserDetails details) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(
                connection -> {
                    PreparedStatement statement = connection.prepareStatement(
                            "INSERT INTO users (first_name, last_name, email) VALUES (?, ?, ?)",
                            new String[] {"id"});
                    statement.setString(1, details.firstName());
                    statement.setString(2, details.lastName());
                    statement.setString(3, details.email());
                    return statement;
                },
                keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert into users returned no generated id");
        }
        log.info("Created user {}", key.longValue());
        return findById(key.longValue())
                .orElseThrow(() -> new IllegalStateException("User " + key + " vanished after insert"));
    }

    @Override
    public Optional<User> update(long id, UserDetails details) {
        int updated = jdbcTemplate.update(
                "UPDATE users SET first_name = ?, last_name = ?, email = ?,"
                        + " updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                details.firstName(),
                details.lastName(),
                details.email(),
                id);
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("Updated user {}", id);
        return findById(id);
    }

    @Override
    public boolean delete(long id) {
        boolean deleted = jdbcTemplate.update("DELETE FROM users WHERE id = ?", id) > 0;
        if (deleted) {
            log.info("Deleted user {}", id);
        }
        return deleted;
    }

    private static User mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                rs.getLong("id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("email"),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
