package com.satoru.literature.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.SearchSession;
import com.satoru.literature.model.SessionSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcSearchSessionRepository implements SearchSessionRepository {

    /**
     * Fixed-width UTC timestamps, so that text order equals time order.
     */
    public static final DateTimeFormatter CREATED_AT_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final TypeReference<List<Article>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<SessionSummary> summaryRowMapper = (rs, rowNum) -> new SessionSummary(
        rs.getObject("id", UUID.class),
        rs.getString("query_text"),
        parseCreatedAt(rs.getString("created_at")),
        rs.getInt("total_count")
    );

    private final RowMapper<SearchSession> sessionRowMapper = (rs, rowNum) -> new SearchSession(
        rs.getObject("id", UUID.class),
        rs.getString("owner"),
        rs.getString("query_text"),
        parseCreatedAt(rs.getString("created_at")),
        rs.getInt("total_count"),
        readSnapshot(rs.getString("snapshot")),
        ContinuationTokenPair.of(rs.getString("web_env"), rs.getString("query_key"))
    );

    @Override
    public SearchSession save(SearchSession session) {
        Instant createdAt = session.createdAt() == null ? Instant.now() : session.createdAt();

        return jdbcClient.sql("""
                INSERT INTO search_sessions (owner, query_text, created_at, total_count, snapshot, web_env, query_key)
                VALUES (:owner, :query, :createdAt, :totalCount, :snapshot, :webEnv, :queryKey)
                RETURNING id, owner, query_text, created_at, total_count, snapshot, web_env, query_key
                """)
            .param("owner", session.owner())
            .param("query", session.query())
            .param("createdAt", formatCreatedAt(createdAt))
            .param("totalCount", session.totalCount())
            .param("snapshot", writeSnapshot(session.snapshot()))
            .param("webEnv", session.tokens().webEnv())
            .param("queryKey", session.tokens().queryKey())
            .query(sessionRowMapper)
            .single();
    }

    @Override
    public List<SessionSummary> findByOwner(String owner, int limit) {
        return jdbcClient.sql("""
                SELECT id, query_text, created_at, total_count
                FROM search_sessions
                WHERE owner = :owner
                ORDER BY created_at DESC, id ASC
                LIMIT :limit
                """)
            .param("owner", owner)
            .param("limit", limit)
            .query(summaryRowMapper)
            .list();
    }

    @Override
    public Optional<SearchSession> findByIdAndOwner(UUID id, String owner) {
        return jdbcClient.sql("SELECT * FROM search_sessions WHERE id = :id AND owner = :owner")
            .param("id", id)
            .param("owner", owner)
            .query(sessionRowMapper)
            .optional();
    }

    @Override
    public int deleteByIdAndOwner(UUID id, String owner) {
        return jdbcClient.sql("DELETE FROM search_sessions WHERE id = :id AND owner = :owner")
            .param("id", id)
            .param("owner", owner)
            .update();
    }

    @Override
    public int deleteAllByOwner(String owner) {
        return jdbcClient.sql("DELETE FROM search_sessions WHERE owner = :owner")
            .param("owner", owner)
            .update();
    }

    public static String formatCreatedAt(Instant instant) {
        return CREATED_AT_FORMAT.format(instant.truncatedTo(ChronoUnit.MICROS));
    }

    private static Instant parseCreatedAt(String value) {
        return Instant.parse(value);
    }

    private String writeSnapshot(List<Article> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize session snapshot", e);
        }
    }

    private List<Article> readSnapshot(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, SNAPSHOT_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored session snapshot is not readable", e);
        }
    }
}
