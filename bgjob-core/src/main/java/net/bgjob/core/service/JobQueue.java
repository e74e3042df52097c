package net.bgjob.core.service;

import net.bgjob.core.model.QueuedJob;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * 클레임했지만 아직 디스패치하지 않은 작업의 대기열.
 * 정렬: priority 내림차순 → 적재 순서 오름차순(FIFO). 비영속이며 블로킹하지 않는다.
 */
public final class JobQueue {

    private record Entry(QueuedJob job, long seq) {}

    private static final Comparator<Entry> ORDER =
            Comparator.comparingInt((Entry e) -> e.job().priority()).reversed()
                    .thenComparingLong(Entry::seq);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private long seq;
    private long enqueuedTotal;
    private long dequeuedTotal;

    public synchronized void enqueue(QueuedJob job) {
        Objects.requireNonNull(job, "job");
        heap.add(new Entry(job, seq++));
        enqueuedTotal++;
    }

    /** 비어 있으면 Optional.empty(). 호출 측은 이번 틱의 소비를 멈춘다 */
    public synchronized Optional<QueuedJob> dequeue() {
        Entry e = heap.poll();
        if (e == null) return Optional.empty();
        dequeuedTotal++;
        return Optional.of(e.job());
    }

    public synchronized int size() { return heap.size(); }

    /** 대기 중인 작업 하나 제거 (취소 요청 시) */
    public synchronized boolean remove(String jobId) {
        return heap.removeIf(e -> e.job().id().equals(jobId));
    }

    /** 세션의 대기 작업을 모두 제거하고 제거된 목록을 반환 */
    public synchronized List<QueuedJob> removeSession(String sessionId) {
        var removed = new ArrayList<QueuedJob>();
        heap.removeIf(e -> {
            if (Objects.equals(e.job().sessionId(), sessionId)) {
                removed.add(e.job());
                return true;
            }
            return false;
        });
        return removed;
    }

    /** 남은 작업 전부를 꺼낸다 (dequeue 순서 그대로). 종료 시 lease 반납용 */
    public synchronized List<QueuedJob> drain() {
        var out = new ArrayList<QueuedJob>(heap.size());
        Entry e;
        while ((e = heap.poll()) != null) out.add(e.job());
        return out;
    }

    public synchronized QueueStats stats() {
        Map<Integer, Integer> byPriority = new TreeMap<>(Comparator.reverseOrder());
        for (Entry e : heap) byPriority.merge(e.job().priority(), 1, Integer::sum);
        return new QueueStats(heap.size(), byPriority, enqueuedTotal, dequeuedTotal);
    }

    public record QueueStats(int size, Map<Integer, Integer> countByPriority, long enqueuedTotal, long dequeuedTotal) {}
}
