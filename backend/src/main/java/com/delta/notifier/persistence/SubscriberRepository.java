package com.delta.notifier.persistence;

import com.delta.notifier.model.Subscriber;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

@Repository
public class SubscriberRepository {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final NamedParameterJdbcTemplate jdbc;

    public SubscriberRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    /**
     * Inserts the subscriber unless a row already exists. Returns {@code true} only when a
     * new row was written; existing preferences are never touched.
     */
    public boolean insertIfAbsent(String subscriberId, LocalTime notifyTime, int repeatIntervalHours, Instant now) {
        if (findById(subscriberId).isPresent()) {
            return false;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("notifyTime", HH_MM.format(notifyTime))
            .addValue("repeatIntervalHours", repeatIntervalHours)
            .addValue("now", Timestamp.from(now));
        try {
            jdbc.update(
                """
                    INSERT INTO subscribers (subscriber_id, notify_time, repeat_interval_hours, created_at, updated_at)
                    VALUES (:subscriberId, :notifyTime, :repeatIntervalHours, :now, :now)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Optional<Subscriber> findById(String subscriberId) {
        List<Subscriber> rows = jdbc.query(
            """
                SELECT subscriber_id, notify_time, repeat_interval_hours, created_at, updated_at
                FROM subscribers
                WHERE subscriber_id = :subscriberId
                """,
            new MapSqlParameterSource().addValue("subscriberId", subscriberId),
            subscriberRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean exists(String subscriberId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM subscribers
                WHERE subscriber_id = :subscriberId
                """,
            new MapSqlParameterSource().addValue("subscriberId", subscriberId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public List<Subscriber> findAll() {
        return jdbc.query(
            """
                SELECT subscriber_id, notify_time, repeat_interval_hours, created_at, updated_at
                FROM subscribers
                ORDER BY created_at, subscriber_id
                """,
            new MapSqlParameterSource(),
            subscriberRowMapper()
        );
    }

    public int updateNotifyTime(String subscriberId, LocalTime notifyTime, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("notifyTime", HH_MM.format(notifyTime))
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE subscribers
                SET notify_time = :notifyTime,
                    updated_at = :now
                WHERE subscriber_id = :subscriberId
                """,
            params
        );
    }

    public int updateRepeatInterval(String subscriberId, int repeatIntervalHours, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("repeatIntervalHours", repeatIntervalHours)
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE subscribers
                SET repeat_interval_hours = :repeatIntervalHours,
                    updated_at = :now
                WHERE subscriber_id = :subscriberId
                """,
            params
        );
    }

    /**
     * Removes the subscriber and every seen-entry row it owns in a single transaction.
     */
    @Transactional
    public int deleteWithSeenEntries(String subscriberId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId);
        jdbc.update(
            """
                DELETE FROM seen_entries
                WHERE subscriber_id = :subscriberId
                """,
            params
        );
        return jdbc.update(
            """
                DELETE FROM subscribers
                WHERE subscriber_id = :subscriberId
                """,
            params
        );
    }

    public long count() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM subscribers", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }

    private RowMapper<Subscriber> subscriberRowMapper() {
        return (rs, rowNum) -> new Subscriber(
            rs.getString("subscriber_id"),
            LocalTime.parse(rs.getString("notify_time"), HH_MM),
            Duration.ofHours(rs.getInt("repeat_interval_hours")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
