package com.yerin.bookpipe.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.Lease;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.global.exception.AlreadyExistsException;
import com.yerin.bookpipe.global.exception.InvalidTransitionException;
import com.yerin.bookpipe.global.exception.JobNotEligibleException;
import com.yerin.bookpipe.global.exception.JobNotFoundException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Redis layout under {@code <prefix>}:
 * <ul>
 *   <li>{@code <prefix>:job:<id>} hash with {@code status}, {@code due} (nextAttemptAt millis) and the JSON {@code record}</li>
 *   <li>{@code <prefix>:lease:<id>} lease owner, expiring with PX</li>
 *   <li>{@code <prefix>:queued} zset scored by createdAt millis (equal scores order by id)</li>
 *   <li>{@code <prefix>:running} zset scored by lease expiry millis</li>
 * </ul>
 */
@Slf4j
@Component
public class RedisJobStateStore implements JobStateStore {

    private static final String OK = "OK";
    private static final String NOT_FOUND = "__NOT_FOUND__";
    private static final String EXISTS = "__EXISTS__";
    private static final String STALE = "__STALE__";
    private static final String LEASE_HELD = "__LEASE_HELD__";
    private static final String LEASE_LOST = "__LEASE_LOST__";
    private static final String NOT_ELIGIBLE = "__NOT_ELIGIBLE__";

    private static final String CREATE_SCRIPT = "if redis.call('EXISTS', KEYS[1]) == 1 then return '__EXISTS__'; end; "
            + "redis.call('HSET', KEYS[1], 'status', ARGV[1], 'record', ARGV[2], 'due', ARGV[5]); "
            + "redis.call('ZADD', KEYS[2], ARGV[3], ARGV[4]); "
            + "return 'OK';";

    // KEYS: job, lease, queued, running
    // ARGV: expected, next, record, guardOwner('' = none), queuedScore, runningScore, retentionSec, id, dueMillis
    private static final String CAS_SCRIPT = "local cur=redis.call('HGET', KEYS[1], 'status'); "
            + "if not cur then return '__NOT_FOUND__'; end; "
            + "if cur~=ARGV[1] then return '__STALE__'; end; "
            + "local holder=redis.call('GET', KEYS[2]); "
            + "if ARGV[4]=='' then "
            + "  if holder then return '__LEASE_HELD__'; end; "
            + "elseif holder~=ARGV[4] then return '__LEASE_LOST__'; end; "
            + "redis.call('HSET', KEYS[1], 'status', ARGV[2], 'record', ARGV[3], 'due', ARGV[9]); "
            + "if ARGV[2]=='queued' then redis.call('ZADD', KEYS[3], ARGV[5], ARGV[8]); "
            + "else redis.call('ZREM', KEYS[3], ARGV[8]); end; "
            + "if ARGV[2]=='running' then redis.call('ZADD', KEYS[4], ARGV[6], ARGV[8]); "
            + "else redis.call('ZREM', KEYS[4], ARGV[8]); end; "
            + "if tonumber(ARGV[7])>0 then redis.call('EXPIRE', KEYS[1], ARGV[7]); end; "
            + "return 'OK';";

    // KEYS: job, lease, running   ARGV: owner, ttlMillis, expiresAtMillis, id
    private static final String ACQUIRE_SCRIPT = "local status=redis.call('HGET', KEYS[1], 'status'); "
            + "if not status then return '__NOT_FOUND__'; end; "
            + "if status~='queued' and status~='running' then return '__NOT_ELIGIBLE__'; end; "
            + "local holder=redis.call('GET', KEYS[2]); "
            + "if holder and holder~=ARGV[1] then return '__LEASE_HELD__'; end; "
            + "if (not holder) and status=='running' then return '__NOT_ELIGIBLE__'; end; "
            + "redis.call('SET', KEYS[2], ARGV[1], 'PX', ARGV[2]); "
            + "if status=='running' then redis.call('ZADD', KEYS[3], 'XX', ARGV[3], ARGV[4]); end; "
            + "return 'OK';";

    // Walks the queued zset in FIFO order and keeps ids whose 'due' is not in the future.
    // KEYS: queued   ARGV: jobKeyPrefix, nowMillis, limit, chunk, maxScan
    private static final String DUE_SCRIPT = "local out={}; local start=0; "
            + "local now=tonumber(ARGV[2]); local limit=tonumber(ARGV[3]); "
            + "local chunk=tonumber(ARGV[4]); local maxScan=tonumber(ARGV[5]); "
            + "while #out<limit and start<maxScan do "
            + "  local ids=redis.call('ZRANGE', KEYS[1], start, start+chunk-1); "
            + "  if #ids==0 then break; end; "
            + "  for _,id in ipairs(ids) do "
            + "    local due=redis.call('HGET', ARGV[1]..id, 'due'); "
            + "    if (not due) or tonumber(due)<=now then "
            + "      out[#out+1]=id; "
            + "      if #out>=limit then break; end; "
            + "    end; "
            + "  end; "
            + "  start=start+chunk; "
            + "end; "
            + "return out;";

    private static final int DUE_SCAN_CHUNK = 100;
    private static final int DUE_SCAN_MAX = 10_000;

    private static final String RELEASE_SCRIPT = "if redis.call('GET', KEYS[1])==ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]); end; return 0;";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration retention;
    private final TransientRetry retry;

    private final DefaultRedisScript<String> createScript;
    private final DefaultRedisScript<String> casScript;
    private final DefaultRedisScript<String> acquireScript;
    private final DefaultRedisScript<Long> releaseScript;
    @SuppressWarnings("rawtypes")
    private final DefaultRedisScript<List> dueScript;

    public RedisJobStateStore(StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock,
                              BookpipeProperties properties) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = properties.getState().getKeyPrefix();
        this.retention = properties.getState().getRetention();
        this.retry = new TransientRetry("redis", properties.getClient(),
                e -> e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException);
        this.createScript = new DefaultRedisScript<>(CREATE_SCRIPT, String.class);
        this.casScript = new DefaultRedisScript<>(CAS_SCRIPT, String.class);
        this.acquireScript = new DefaultRedisScript<>(ACQUIRE_SCRIPT, String.class);
        this.releaseScript = new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class);
        this.dueScript = new DefaultRedisScript<>(DUE_SCRIPT, List.class);
    }

    @Override
    public void create(JobRecord record) {
        String result = retry.call("create", () -> redis.execute(
                createScript,
                List.of(jobKey(record.id()), queuedKey()),
                record.status().code(),
                toJson(record),
                String.valueOf(record.createdAt().toEpochMilli()),
                record.id(),
                String.valueOf(dueMillis(record))
        ));
        if (EXISTS.equals(result)) {
            throw new AlreadyExistsException(record.id());
        }
        log.debug("[StateStore] created jobId={}", record.id());
    }

    @Override
    public JobRecord get(String id) {
        Object json = retry.call("get", () -> redis.opsForHash().get(jobKey(id), "record"));
        if (json == null) {
            throw new JobNotFoundException(id);
        }
        return fromJson(json.toString());
    }

    @Override
    public void compareAndSwapStatus(String id, JobStatus expectedStatus, JobRecord next, LeaseGuard guard) {
        if (!id.equals(next.id())) {
            throw new IllegalArgumentException("record id mismatch: " + id + " vs " + next.id());
        }
        if (!expectedStatus.canTransitionTo(next.status())) {
            throw new InvalidTransitionException(id, expectedStatus, next.status());
        }
        long runningScore = next.leaseExpiresAt() != null ? next.leaseExpiresAt().toEpochMilli() : 0L;
        long retentionSeconds = next.status().isTerminal() ? Math.max(1L, retention.toSeconds()) : 0L;

        String result = retry.call("cas", () -> redis.execute(
                casScript,
                List.of(jobKey(id), leaseKey(id), queuedKey(), runningKey()),
                expectedStatus.code(),
                next.status().code(),
                toJson(next),
                guard.requiresNoLease() ? "" : guard.owner(),
                String.valueOf(next.createdAt().toEpochMilli()),
                String.valueOf(runningScore),
                String.valueOf(retentionSeconds),
                id,
                String.valueOf(dueMillis(next))
        ));

        switch (result == null ? "" : result) {
            case OK -> log.debug("[StateStore] cas jobId={} {} -> {}", id, expectedStatus.code(), next.status().code());
            case NOT_FOUND -> throw new JobNotFoundException(id);
            case STALE -> throw new StaleStateException(id, "expected=" + expectedStatus.code());
            case LEASE_HELD -> throw new LeaseHeldException(id);
            case LEASE_LOST -> throw new StaleStateException(id, "lease lost by " + guard.owner());
            default -> throw new IllegalStateException("unexpected cas result: " + result);
        }
    }

    @Override
    public Lease acquireLease(String id, String owner, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        String result = retry.call("acquireLease", () -> redis.execute(
                acquireScript,
                List.of(jobKey(id), leaseKey(id), runningKey()),
                owner,
                String.valueOf(ttl.toMillis()),
                String.valueOf(expiresAt.toEpochMilli()),
                id
        ));

        switch (result == null ? "" : result) {
            case OK -> {
                return new Lease(id, owner, expiresAt);
            }
            case NOT_FOUND -> throw new JobNotFoundException(id);
            case LEASE_HELD -> throw new LeaseHeldException(id);
            case NOT_ELIGIBLE -> throw new JobNotEligibleException(id);
            default -> throw new IllegalStateException("unexpected lease result: " + result);
        }
    }

    @Override
    public void releaseLease(String id, String owner) {
        Long deleted = retry.call("releaseLease", () -> redis.execute(releaseScript, List.of(leaseKey(id)), owner));
        if (deleted == null || deleted == 0L) {
            log.debug("[StateStore] lease not released (not held) jobId={}, owner={}", id, owner);
        }
    }

    @Override
    public boolean hasLiveLease(String id) {
        return Boolean.TRUE.equals(retry.call("hasLiveLease", () -> redis.hasKey(leaseKey(id))));
    }

    @Override
    public List<String> queuedCandidates(int limit) {
        Set<String> ids = retry.call("queuedCandidates",
                () -> redis.opsForZSet().range(queuedKey(), 0, limit - 1L));
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    @Override
    public List<String> dueCandidates(Instant now, int limit) {
        List<?> ids = retry.call("dueCandidates", () -> (List<?>) redis.execute(
                dueScript,
                List.of(queuedKey()),
                keyPrefix + ":job:",
                String.valueOf(now.toEpochMilli()),
                String.valueOf(limit),
                String.valueOf(DUE_SCAN_CHUNK),
                String.valueOf(DUE_SCAN_MAX)
        ));
        if (ids == null) return List.of();
        List<String> result = new ArrayList<>(ids.size());
        for (Object id : ids) {
            result.add(String.valueOf(id));
        }
        return result;
    }

    @Override
    public List<String> expiredRunning(Instant now, int limit) {
        Set<String> ids = retry.call("expiredRunning",
                () -> redis.opsForZSet().rangeByScore(runningKey(), 0, now.toEpochMilli(), 0, limit));
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    @Override
    public boolean ping() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("[StateStore] ping failed: {}", e.toString());
            return false;
        }
    }

    private static long dueMillis(JobRecord record) {
        return record.nextAttemptAt() != null ? record.nextAttemptAt().toEpochMilli() : 0L;
    }

    private String toJson(JobRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("job record serialization failed: " + record.id(), e);
        }
    }

    private JobRecord fromJson(String json) {
        try {
            return objectMapper.readValue(json, JobRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("job record deserialization failed", e);
        }
    }

    private String jobKey(String id) {
        return keyPrefix + ":job:" + id;
    }

    private String leaseKey(String id) {
        return keyPrefix + ":lease:" + id;
    }

    private String queuedKey() {
        return keyPrefix + ":queued";
    }

    private String runningKey() {
        return keyPrefix + ":running";
    }
}
