package com.sage.memory.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.memory.AccessFailureRecord;
import com.sage.memory.CheckpointStore;
import com.sage.memory.MemoryDocument;
import com.sage.memory.MemoryStore;
import com.sage.memory.SourceLearning;
import com.sage.memory.TextSimilarity;
import com.sage.model.ResearchState;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL memory and checkpoint store. Every method opens its own connection and surfaces failures as
 * {@link IllegalStateException}; wrap it in {@code ResilientMemory} for fail-safe use.
 */
public final class JdbcMemoryStore implements MemoryStore, CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMemoryStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() { };
    private static final int CANDIDATE_LIMIT = 200;

    private final MemorySchemaBootstrapper.ConnectionProvider connections;

    public JdbcMemoryStore(MemorySchemaBootstrapper.ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    @Override
    public String storeDocument(String content, Map<String, String> metadata, String sessionId) {
        UUID id = UUID.randomUUID();
        String sql = "INSERT INTO sage_documents (id, session_id, content, metadata) VALUES (?,?,?,?)";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setString(2, sessionId);
            ps.setString(3, content != null ? content : "");
            ps.setObject(4, jsonb(MAPPER.writeValueAsString(metadata != null ? metadata : Map.of())));
            ps.executeUpdate();
            return id.toString();
        } catch (SQLException | JsonProcessingException e) {
            throw failure("storeDocument", e);
        }
    }

    /**
     * Pre-filters candidates in SQL (any query term, metadata containment) and ranks them with
     * {@link TextSimilarity}.
     */
    @Override
    public List<MemoryDocument> searchSimilar(String query, int limit, Map<String, String> filters) {
        Set<String> terms = new LinkedHashSet<>();
        for (String t : (query != null ? query : "").toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (t.length() > 1) terms.add(t);
        }
        if (terms.isEmpty() || limit <= 0) return List.of();

        Map<String, String> metadataFilters = new HashMap<>(filters != null ? filters : Map.of());
        String sessionFilter = metadataFilters.remove("session_id");
        StringBuilder sql = new StringBuilder("SELECT id, session_id, content, metadata FROM sage_documents WHERE metadata @> ?");
        if (sessionFilter != null) sql.append(" AND session_id = ?");
        sql.append(" AND (");
        for (int i = 0; i < terms.size(); i++) sql.append(i > 0 ? " OR " : "").append("content ILIKE ?");
        sql.append(") LIMIT ").append(CANDIDATE_LIMIT);

        List<MemoryDocument> scored = new ArrayList<>();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setObject(idx++, jsonb(MAPPER.writeValueAsString(metadataFilters)));
            if (sessionFilter != null) ps.setString(idx++, sessionFilter);
            for (String t : terms) ps.setString(idx++, "%" + t + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String content = rs.getString("content");
                    double score = TextSimilarity.score(query, content);
                    Map<String, String> metadata = MAPPER.readValue(rs.getString("metadata"), METADATA_TYPE);
                    scored.add(new MemoryDocument(rs.getString("id"), content, metadata, rs.getString("session_id"), score));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw failure("searchSimilar", e);
        }
        scored.sort(Comparator.comparingDouble(MemoryDocument::getScore).reversed());
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    @Override
    public double getSourceEffectiveness(String source, String domain) {
        String sql = "SELECT score FROM sage_source_effectiveness WHERE source=? AND domain=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, source);
            ps.setString(2, domain);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : DEFAULT_EFFECTIVENESS;
            }
        } catch (SQLException e) {
            throw failure("getSourceEffectiveness", e);
        }
    }

    @Override
    public void updateSourceEffectiveness(String source, String domain, boolean success, double quality) {
        double updated = SourceLearning.ema(getSourceEffectiveness(source, domain), success, quality);
        String sql = "INSERT INTO sage_source_effectiveness (source, domain, score, updated_at) VALUES (?,?,?,now()) "
                + "ON CONFLICT (source, domain) DO UPDATE SET score = EXCLUDED.score, updated_at = now()";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, source);
            ps.setString(2, domain);
            ps.setDouble(3, updated);
            ps.executeUpdate();
            log.debug("Effectiveness {}/{} -> {}", source, domain, updated);
        } catch (SQLException e) {
            throw failure("updateSourceEffectiveness", e);
        }
    }

    @Override
    public void recordAccessFailure(String url, String source, String errorType, String message) {
        String sql = "INSERT INTO sage_access_failures (url, source, error_type, message, first_seen, last_seen, retry_count) "
                + "VALUES (?,?,?,?,?,?,1) ON CONFLICT (url) DO UPDATE SET retry_count = sage_access_failures.retry_count + 1, "
                + "last_seen = EXCLUDED.last_seen, message = EXCLUDED.message";
        Timestamp now = new Timestamp(System.currentTimeMillis());
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, url);
            ps.setString(2, source);
            ps.setString(3, errorType);
            ps.setString(4, message);
            ps.setTimestamp(5, now);
            ps.setTimestamp(6, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("recordAccessFailure", e);
        }
    }

    @Override
    public boolean isKnownFailure(String url) {
        return getAccessFailure(url).isPresent();
    }

    @Override
    public Optional<AccessFailureRecord> getAccessFailure(String url) {
        if (url == null) return Optional.empty();
        String sql = "SELECT url, source, error_type, message, first_seen, last_seen, retry_count FROM sage_access_failures WHERE url=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, url);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new AccessFailureRecord(rs.getString("url"), rs.getString("source"),
                        rs.getString("error_type"), rs.getString("message"),
                        rs.getTimestamp("first_seen").getTime(), rs.getTimestamp("last_seen").getTime(),
                        rs.getInt("retry_count")));
            }
        } catch (SQLException e) {
            throw failure("getAccessFailure", e);
        }
    }

    @Override
    public void save(ResearchState state) {
        String sql = "INSERT INTO sage_checkpoints (session_id, phase, state_json, archived, updated_at) VALUES (?,?,?,FALSE,now()) "
                + "ON CONFLICT (session_id) DO UPDATE SET phase = EXCLUDED.phase, state_json = EXCLUDED.state_json, updated_at = now()";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.getSessionId());
            ps.setString(2, state.getPhase().name());
            ps.setObject(3, jsonb(state.toJson()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("save checkpoint", e);
        }
    }

    @Override
    public Optional<ResearchState> load(String sessionId) {
        String sql = "SELECT state_json FROM sage_checkpoints WHERE session_id=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(ResearchState.fromJson(rs.getString(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("load checkpoint", e);
        }
    }

    @Override
    public void archive(String sessionId) {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE sage_checkpoints SET archived = TRUE, updated_at = now() WHERE session_id=?")) {
            ps.setString(1, sessionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("archive checkpoint", e);
        }
    }

    static PGobject jsonb(String json) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json != null ? json : "{}");
        return o;
    }

    private static IllegalStateException failure(String operation, Exception e) {
        String state = e instanceof SQLException ? " SQLState=" + ((SQLException) e).getSQLState() : "";
        return new IllegalStateException("Memory " + operation + " failed: " + e.getMessage() + state, e);
    }
}
