package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.Lease;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.global.exception.AlreadyExistsException;
import com.yerin.bookpipe.global.exception.InvalidTransitionException;
import com.yerin.bookpipe.global.exception.JobNotEligibleException;
import com.yerin.bookpipe.global.exception.JobNotFoundException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import com.yerin.bookpipe.support.IntegrationTestBase;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "bookpipe.worker.enabled=false")
@DisplayName("Redis 상태 저장소 Lua 스크립트 통합 테스트")
class RedisJobStateStoreIT extends IntegrationTestBase {

    @Autowired
    RedisJobStateStore store;

    @Autowired
    StringRedisTemplate redis;

    @BeforeEach
    void clean() {
        Set<String> keys = redis.keys("bookpipe-it:*");
        if (keys != null && !keys.isEmpty()) {
            redis.delete(keys);
        }
    }

    JobRecord queued(String id, Instant createdAt) {
        return JobRecord.queued(id, id + "/input/a.txt", "a.txt", null, "text/plain", 3, "ingest",
                createdAt.truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    @DisplayName("생성 후 조회, 같은 id 재생성은 AlreadyExists, 없는 id는 NotFound")
    void create_and_get() {
        JobRecord record = queued("job-1", Instant.now()).withChecksum("abc");
        store.create(record);

        assertThat(store.get("job-1")).isEqualTo(record);
        assertThatThrownBy(() -> store.create(record)).isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("queued 후보는 createdAt 순, 같으면 id 순")
    void queued_candidates_are_fifo() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        store.create(queued("c", t0.plusMillis(1)));
        store.create(queued("b", t0));
        store.create(queued("a", t0));

        assertThat(store.queuedCandidates(10)).containsExactly("a", "b", "c");
        assertThat(store.queuedCandidates(2)).containsExactly("a", "b");
    }

    @Test
    @DisplayName("due 후보는 백오프 중인 작업을 건너뛰고 FIFO 순서를 유지")
    void due_candidates_pass_over_backed_off_jobs() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 150; i++) {
            String id = String.format("wait-%03d", i);
            store.create(queued(id, t0).toBuilder().nextAttemptAt(t0.plusSeconds(60)).build());
        }
        store.create(queued("fresh-b", t0.plusMillis(2)));
        store.create(queued("fresh-a", t0.plusMillis(1)));

        Instant now = t0.plusSeconds(2);
        assertThat(store.dueCandidates(now, 20)).containsExactly("fresh-a", "fresh-b");
        assertThat(store.dueCandidates(now, 1)).containsExactly("fresh-a");
        assertThat(store.dueCandidates(t0.plusSeconds(60), 3)).containsExactly("wait-000", "wait-001", "wait-002");
    }

    @Test
    @DisplayName("재대기(requeue) 시 nextAttemptAt이 due 후보에 반영됨")
    void requeue_updates_due_time() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        store.create(queued("job-r", t0));
        JobRecord running = store.get("job-r").startRunning(
                store.acquireLease("job-r", "w1", Duration.ofSeconds(30)), t0);
        store.compareAndSwapStatus("job-r", JobStatus.QUEUED, running, LeaseGuard.heldBy("w1"));
        store.compareAndSwapStatus("job-r", JobStatus.RUNNING,
                running.requeue(1, t0.plusSeconds(10), t0), LeaseGuard.heldBy("w1"));
        store.releaseLease("job-r", "w1");

        assertThat(store.dueCandidates(t0.plusSeconds(5), 10)).isEmpty();
        assertThat(store.dueCandidates(t0.plusSeconds(10), 10)).containsExactly("job-r");
    }

    @Test
    @DisplayName("CAS: 기대 상태가 다르면 Stale, 허용되지 않는 전이는 InvalidTransition")
    void cas_checks_expected_status_and_transition() {
        JobRecord record = queued("job-2", Instant.now());
        store.create(record);
        Instant now = Instant.now();

        assertThatThrownBy(() -> store.compareAndSwapStatus("job-2", JobStatus.RUNNING,
                record.requeue(1, now, now), LeaseGuard.none()))
                .isInstanceOf(StaleStateException.class);
        assertThatThrownBy(() -> store.compareAndSwapStatus("job-2", JobStatus.QUEUED,
                record.succeed(now), LeaseGuard.none()))
                .isInstanceOf(InvalidTransitionException.class);

        store.compareAndSwapStatus("job-2", JobStatus.QUEUED, record.cancel(now), LeaseGuard.none());
        assertThat(store.get("job-2").status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(store.queuedCandidates(10)).doesNotContain("job-2");
        assertThat(redis.getExpire("bookpipe-it:job:job-2")).isPositive();
    }

    @Test
    @DisplayName("리스: 다른 소유자는 LeaseHeld, 리스가 있으면 취소 불가, 해제 후 취소 가능")
    void lease_blocks_cancel_until_released() {
        JobRecord record = queued("job-3", Instant.now());
        store.create(record);

        Lease lease = store.acquireLease("job-3", "w1", Duration.ofSeconds(30));
        assertThat(lease.owner()).isEqualTo("w1");
        assertThat(store.hasLiveLease("job-3")).isTrue();
        assertThatThrownBy(() -> store.acquireLease("job-3", "w2", Duration.ofSeconds(30)))
                .isInstanceOf(LeaseHeldException.class);
        assertThatThrownBy(() -> store.compareAndSwapStatus("job-3", JobStatus.QUEUED,
                record.cancel(Instant.now()), LeaseGuard.none()))
                .isInstanceOf(LeaseHeldException.class);

        store.releaseLease("job-3", "w2");
        assertThat(store.hasLiveLease("job-3")).isTrue();
        store.releaseLease("job-3", "w1");
        assertThat(store.hasLiveLease("job-3")).isFalse();

        store.compareAndSwapStatus("job-3", JobStatus.QUEUED, record.cancel(Instant.now()), LeaseGuard.none());
        assertThatThrownBy(() -> store.acquireLease("job-3", "w1", Duration.ofSeconds(30)))
                .isInstanceOf(JobNotEligibleException.class);
    }

    @Test
    @DisplayName("리스를 잃은 워커의 CAS는 Stale, 만료된 running 작업은 만료 목록에 나타남")
    void expired_lease_is_detected() {
        JobRecord record = queued("job-4", Instant.now());
        store.create(record);
        Lease lease = store.acquireLease("job-4", "w1", Duration.ofMillis(300));
        JobRecord running = record.startRunning(lease, Instant.now());
        store.compareAndSwapStatus("job-4", JobStatus.QUEUED, running, LeaseGuard.heldBy("w1"));

        Awaitility.await().atMost(Duration.ofSeconds(3)).pollInterval(Duration.ofMillis(100))
                .until(() -> !store.hasLiveLease("job-4"));

        assertThat(store.expiredRunning(Instant.now(), 10)).contains("job-4");
        assertThatThrownBy(() -> store.compareAndSwapStatus("job-4", JobStatus.RUNNING,
                running.succeed(Instant.now()), LeaseGuard.heldBy("w1")))
                .isInstanceOf(StaleStateException.class);
        assertThatThrownBy(() -> store.acquireLease("job-4", "w1", Duration.ofSeconds(5)))
                .isInstanceOf(JobNotEligibleException.class);

        Instant now = Instant.now();
        store.compareAndSwapStatus("job-4", JobStatus.RUNNING, running.requeue(1, now, now), LeaseGuard.none());
        assertThat(store.expiredRunning(Instant.now(), 10)).doesNotContain("job-4");
        assertThat(store.queuedCandidates(10)).contains("job-4");
    }

    @Test
    @DisplayName("같은 소유자의 리스 연장은 running 만료 시각을 갱신")
    void renew_extends_running_expiry() {
        JobRecord record = queued("job-5", Instant.now());
        store.create(record);
        Lease first = store.acquireLease("job-5", "w1", Duration.ofSeconds(1));
        store.compareAndSwapStatus("job-5", JobStatus.QUEUED, record.startRunning(first, Instant.now()),
                LeaseGuard.heldBy("w1"));

        store.acquireLease("job-5", "w1", Duration.ofSeconds(60));

        assertThat(store.expiredRunning(Instant.now().plusSeconds(5), 10)).doesNotContain("job-5");
        assertThat(store.ping()).isTrue();
    }
}
