package com.delta.notifier.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

@Repository
public class SeenEntryRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public SeenEntryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Set<String> findIdentities(String subscriberId) {
        Set<String> identities = new HashSet<>();
        jdbc.query(
            """
                SELECT entry_identity
                FROM seen_entries
                WHERE subscriber_id = :subscriberId
                """,
            new MapSqlParameterSource().addValue("subscriberId", subscriberId),
            rs -> {
                identities.add(rs.getString("entry_identity"));
            }
        );
        return identities;
    }

    public boolean contains(String subscriberId, String identity) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM seen_entries
                WHERE subscriber_id = :subscriberId
                  AND entry_identity = :identity
                """,
            new MapSqlParameterSource()
                .addValue("subscriberId", subscriberId)
                .addValue("identity", identity),
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * Records all identities for the subscriber atomically. Callers pass only identities
     * that are not yet recorded; a duplicate fails the whole batch.
     */
    @Transactional
    public int markSeen(String subscriberId, Collection<String> identities, Instant seenAt) {
        Set<String> unique = new LinkedHashSet<>(identities);
        if (unique.isEmpty()) {
            return 0;
        }
        Timestamp timestamp = Timestamp.from(seenAt);
        SqlParameterSource[] batch = unique.stream()
            .map(identity -> new MapSqlParameterSource()
                .addValue("subscriberId", subscriberId)
                .addValue("identity", identity)
                .addValue("seenAt", timestamp))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO seen_entries (subscriber_id, entry_identity, seen_at)
                VALUES (:subscriberId, :identity, :seenAt)
                """,
            batch
        );
        return unique.size();
    }

    public int countForSubscriber(String subscriberId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM seen_entries
                WHERE subscriber_id = :subscriberId
                """,
            new MapSqlParameterSource().addValue("subscriberId", subscriberId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public long count() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM seen_entries", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }
}
