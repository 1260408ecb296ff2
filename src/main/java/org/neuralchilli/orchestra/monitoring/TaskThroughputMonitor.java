package org.neuralchilli.orchestra.monitoring;

import org.neuralchilli.orchestra.domain.ExecutorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for task throughput, kept alongside the manager's
 * status sets so they can be read without taking the manager lock.
 *
 * Tracks:
 * - dispatches, completions, failures, retries, cancellations and timeouts
 * - attempt duration per executor type
 */
public class TaskThroughputMonitor {

    private static final Logger log = LoggerFactory.getLogger(TaskThroughputMonitor.class);

    private final LongAdder tasksRegistered = new LongAdder();
    private final LongAdder tasksDispatched = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksRetried = new LongAdder();
    private final LongAdder tasksCancelled = new LongAdder();
    private final LongAdder attemptsTimedOut = new LongAdder();

    private final Map<ExecutorType, TimingStats> attemptTimings = new ConcurrentHashMap<>();

    public void recordTaskRegistered() {
        tasksRegistered.increment();
    }

    public void recordTaskDispatched() {
        tasksDispatched.increment();
    }

    public void recordTaskCompleted() {
        tasksCompleted.increment();
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordTaskRetried() {
        tasksRetried.increment();
    }

    public void recordTaskCancelled() {
        tasksCancelled.increment();
    }

    public void recordAttemptTimedOut() {
        attemptsTimedOut.increment();
    }

    /**
     * Record how long one attempt held its executor.
     */
    public void recordAttempt(ExecutorType executorType, Duration duration) {
        attemptTimings.computeIfAbsent(executorType, key -> new TimingStats()).record(duration);
    }

    /**
     * Get task success rate over finished tasks, as a percentage.
     */
    public double getTaskSuccessRate() {
        long completed = tasksCompleted.sum();
        long failed = tasksFailed.sum();
        long total = completed + failed;
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    public TimingStats getAttemptTimings(ExecutorType executorType) {
        return attemptTimings.getOrDefault(executorType, new TimingStats());
    }

    /**
     * Statistics for attempt timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long total = totalNanos.sum();
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(total / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    public ThroughputReport getReport() {
        Map<ExecutorType, Duration> averages = new EnumMap<>(ExecutorType.class);
        attemptTimings.forEach((type, stats) -> averages.put(type, stats.getAverage()));

        return new ThroughputReport(
                tasksRegistered.sum(),
                tasksDispatched.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                tasksRetried.sum(),
                tasksCancelled.sum(),
                attemptsTimedOut.sum(),
                getTaskSuccessRate(),
                averages
        );
    }

    /**
     * Throughput report snapshot.
     */
    public record ThroughputReport(
            long registered,
            long dispatched,
            long completed,
            long failed,
            long retried,
            long cancelled,
            long timedOut,
            double successRate,
            Map<ExecutorType, Duration> averageAttemptTime
    ) {
        public ThroughputReport {
            averageAttemptTime = Map.copyOf(averageAttemptTime);
        }

        @Override
        public String toString() {
            return String.format("""
                Task Throughput:
                ================
                  Registered: %d, Dispatched: %d
                  Completed: %d, Failed: %d, Cancelled: %d
                  Retries: %d, Timeouts: %d
                  Success Rate: %.1f%%
                  Avg Attempt Time: %s
                """,
                    registered, dispatched,
                    completed, failed, cancelled,
                    retried, timedOut,
                    successRate,
                    averageAttemptTime
            );
        }
    }

    /**
     * Log current throughput report.
     */
    public void logReport() {
        log.info("\n{}", getReport());
    }
}
