package net.bgjob.adapter.jdbc;

import net.bgjob.adapter.jdbc.repo.JdbcJobStore;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobType;
import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 여러 클레이머가 동시에 큐를 비울 때 같은 행을 두 번 가져가지 않는지 확인
 */
class ConcurrentClaimAcceptanceTest extends TestSupport {

    TxRunner tx;
    JdbcJobStore store;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        store = new JdbcJobStore(OM, Clock.system());
    }

    @BeforeEach
    void clean() throws Exception {
        deleteAll(tx);
    }

    @Test
    void concurrent_claimers_never_share_a_job() throws Exception {
        final int total = 60;
        final int threads = 6;
        Instant t = Instant.now();
        for (int i = 0; i < total; i++) {
            Job j = row(String.format("job-%03d", i), "s", JobType.TEXT_IMPROVEMENT, i % 4, JobStatus.QUEUED,
                    t.plusMillis(i), t);
            tx.required(() -> { store.insert(j); return null; });
        }

        List<String> claimed = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < threads; w++) {
            futures.add(pool.submit(() -> {
                ready.countDown();
                go.await();
                int idle = 0;
                while (idle < 3) {
                    List<Job> batch = tx.requiresNew(() -> store.claimQueuedJobs(4));
                    if (batch.isEmpty()) { idle++; continue; }
                    idle = 0;
                    batch.forEach(j -> claimed.add(j.id()));
                }
                return null;
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        Set<String> unique = new HashSet<>(claimed);
        assertEquals(claimed.size(), unique.size(), "duplicate claims: " + claimed);
        assertEquals(total, unique.size(), "every queued job is claimed exactly once");

        long stillQueued = tx.required(store::listActiveJobs).stream()
                .filter(j -> j.status() == JobStatus.QUEUED).count();
        assertEquals(0, stillQueued);
    }

    @Test
    void claim_never_returns_more_than_limit() throws Exception {
        Instant t = Instant.now();
        for (int i = 0; i < 10; i++) {
            Job j = row("j" + i, "s", JobType.PATH_FINDER, 0, JobStatus.QUEUED, t.plusMillis(i), t);
            tx.required(() -> { store.insert(j); return null; });
        }

        assertEquals(3, tx.requiresNew(() -> store.claimQueuedJobs(3)).size());
        assertEquals(7, tx.requiresNew(() -> store.claimQueuedJobs(50)).size());
    }
}
