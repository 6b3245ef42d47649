package com.polyspike.hft.engine.supervisor;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.TradingState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs each named task on its own platform thread and keeps it alive until shutdown.
 * <p>
 * A crashed task is restarted after {@code restartDelayMillis}; once it fails more than
 * {@code maxConsecutiveFailures} times in a row the supervisor waits {@code escalationBackoffMillis} instead and
 * starts counting again. A task is never abandoned while the engine runs.
 */
@Slf4j
public class WorkerSupervisor {

    private final TradingState state;
    private final HftProperties.Supervisor config;

    private final Map<String, SupervisedTask> tasks = new LinkedHashMap<>();
    private final Map<String, Thread> threads = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> restarts = new ConcurrentHashMap<>();
    private volatile boolean started;

    public WorkerSupervisor(TradingState state, HftProperties.Supervisor config) {
        this.state = Objects.requireNonNull(state, "state");
        this.config = Objects.requireNonNull(config, "config");
    }

    public synchronized void register(SupervisedTask task) {
        if (started) {
            throw new IllegalStateException("Cannot register task after start: " + task.name());
        }
        if (tasks.putIfAbsent(task.name(), task) != null) {
            throw new IllegalArgumentException("Duplicate task name: " + task.name());
        }
        restarts.put(task.name(), new AtomicLong());
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        for (SupervisedTask task : tasks.values()) {
            Thread t = new Thread(() -> supervise(task), "polyspike-" + task.name());
            t.setDaemon(true);
            threads.put(task.name(), t);
            t.start();
        }
        log.info("SUPERVISOR: started {} tasks {}", tasks.size(), tasks.keySet());
    }

    /**
     * Requests shutdown, waits for every task, interrupts stragglers, then clears the shared state.
     */
    public void stop() {
        state.requestShutdown();
        long timeoutMillis = config.stopTimeoutMillis();
        List<String> stragglers = new ArrayList<>();
        for (Map.Entry<String, Thread> e : threads.entrySet()) {
            Thread t = e.getValue();
            try {
                t.join(timeoutMillis);
                if (t.isAlive()) {
                    stragglers.add(e.getKey());
                    t.interrupt();
                    t.join(1_000);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                t.interrupt();
            }
        }
        if (!stragglers.isEmpty()) {
            log.warn("SUPERVISOR: tasks did not stop within {}ms and were interrupted: {}", timeoutMillis, stragglers);
        }
        state.cleanup();
        state.markCleanupComplete();
        log.info("SUPERVISOR: stopped");
    }

    public int activeTaskCount() {
        int alive = 0;
        for (Thread t : threads.values()) {
            if (t.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    public List<String> taskNames() {
        synchronized (this) {
            return List.copyOf(tasks.keySet());
        }
    }

    public long restartCount(String taskName) {
        AtomicLong n = restarts.get(taskName);
        return n == null ? 0 : n.get();
    }

    public long totalRestarts() {
        return restarts.values().stream().mapToLong(AtomicLong::get).sum();
    }

    private void supervise(SupervisedTask task) {
        int consecutiveFailures = 0;
        while (!state.isShutdown()) {
            try {
                task.run();
                if (state.isShutdown()) {
                    break;
                }
                consecutiveFailures = 0;
                log.warn("SUPERVISOR: task {} returned while running, restarting in {}ms",
                        task.name(), config.restartDelayMillis());
            } catch (InterruptedException e) {
                if (state.isShutdown()) {
                    break;
                }
                Thread.interrupted();
                consecutiveFailures++;
                log.warn("SUPERVISOR: task {} interrupted while running (failure {} in a row)",
                        task.name(), consecutiveFailures);
            } catch (Exception e) {
                consecutiveFailures++;
                log.error("SUPERVISOR: task {} crashed (failure {} in a row): {}",
                        task.name(), consecutiveFailures, e.toString(), e);
            }

            long delay = config.restartDelayMillis();
            if (consecutiveFailures > config.maxConsecutiveFailures()) {
                delay = config.escalationBackoffMillis();
                log.error("SUPERVISOR: task {} failed {} times in a row, backing off {}ms before restart",
                        task.name(), consecutiveFailures, delay);
                consecutiveFailures = 0;
            }
            if (pause(delay)) {
                break;
            }
            restarts.get(task.name()).incrementAndGet();
            log.info("SUPERVISOR: restarting task {}", task.name());
        }
        log.info("SUPERVISOR: task {} exited", task.name());
    }

    private boolean pause(long millis) {
        try {
            return state.awaitShutdown(Duration.ofMillis(millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
