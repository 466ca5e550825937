package com.sage.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Publishes progress to Redis: the latest snapshot JSON is SET at {@code sage:progress:<sessionId>} and PUBLISHed on
 * {@code sage:progress}. Redis failures are logged and never reach the orchestrator.
 */
public final class RedisProgressSink implements ProgressListener, AutoCloseable {

    public static final String KEY_PREFIX = "sage:progress:";
    public static final String CHANNEL = "sage:progress";

    private static final Logger log = LoggerFactory.getLogger(RedisProgressSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JedisPool pool;

    public RedisProgressSink(String host, int port) {
        this(host, port, new JedisPoolConfig());
    }

    public RedisProgressSink(String host, int port, JedisPoolConfig poolConfig) {
        Objects.requireNonNull(host, "host");
        this.pool = new JedisPool(poolConfig, host, port);
        log.debug("RedisProgressSink connected to {}:{}", host, port);
    }

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        String json;
        try {
            json = toJson(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Progress snapshot not serializable (sessionId={}): {}", snapshot.getSessionId(), e.getMessage());
            return;
        }
        try (var jedis = pool.getResource()) {
            jedis.set(key(snapshot.getSessionId()), json);
            jedis.publish(CHANNEL, json);
        } catch (RuntimeException e) {
            log.warn("Redis progress publish failed (sessionId={}, sequence={}); execution continues. Error: {}",
                    snapshot.getSessionId(), snapshot.getSequence(), e.getMessage());
        }
    }

    /** Latest snapshot stored for the session, for clients that poll. */
    public Optional<ProgressSnapshot> latest(String sessionId) {
        try (var jedis = pool.getResource()) {
            String json = jedis.get(key(sessionId));
            return json == null ? Optional.empty() : Optional.of(MAPPER.readValue(json, ProgressSnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("Stored progress for {} is not valid JSON: {}", sessionId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Redis progress read failed (sessionId={}). Error: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    static String toJson(ProgressSnapshot snapshot) throws JsonProcessingException {
        return MAPPER.writeValueAsString(snapshot);
    }

    @Override
    public void close() {
        pool.close();
    }
}
