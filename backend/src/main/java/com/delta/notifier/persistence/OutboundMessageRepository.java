package com.delta.notifier.persistence;

import com.delta.notifier.model.OutboundMessage;
import com.delta.notifier.model.OutboundMessageKind;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class OutboundMessageRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public OutboundMessageRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(String subscriberId, OutboundMessageKind kind, String body, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("kind", kind.name())
            .addValue("body", body)
            .addValue("createdAt", Timestamp.from(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO outbound_messages (subscriber_id, kind, body, created_at)
                VALUES (:subscriberId, :kind, :body, :createdAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert outbound message");
        }
        return key.longValue();
    }

    public List<OutboundMessage> findRecent(String subscriberId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, subscriber_id, kind, body, created_at
                FROM outbound_messages
                WHERE subscriber_id = :subscriberId
                ORDER BY id DESC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new OutboundMessage(
                rs.getLong("id"),
                rs.getString("subscriber_id"),
                OutboundMessageKind.valueOf(rs.getString("kind")),
                rs.getString("body"),
                rs.getTimestamp("created_at") == null ? null : rs.getTimestamp("created_at").toInstant()
            )
        );
    }

    public long count() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM outbound_messages", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }
}
