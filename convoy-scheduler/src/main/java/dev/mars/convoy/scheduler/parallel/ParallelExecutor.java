/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.scheduler.parallel;

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.queue.ExecutionQueue;
import dev.mars.convoy.queue.QueueItem;
import dev.mars.convoy.retry.RetryManager;
import dev.mars.convoy.scheduler.observability.ParallelMetrics;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.scheduler.profile.ProfileRunner;
import dev.mars.convoy.scheduler.profile.ProfileSession;
import dev.mars.convoy.scheduler.profile.ProfileSessionProvider;
import dev.mars.convoy.workflow.StepProgress;
import dev.mars.convoy.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one workflow across many profiles, at most {@code maxConcurrent} at a time.
 * <p>
 * A single dispatcher (the thread that called {@link #start}) moves queued profiles into
 * slots. Each slot runs on its own thread: it opens the profile's session, runs the workflow
 * under the configured timeout, and then records the outcome or re-queues the profile after
 * the retry delay. The queue, the slot map and the result lists are guarded by one lock,
 * and the dispatcher sleeps on its condition until an enqueue, a slot end, a retry
 * re-enqueue, a resume or a stop wakes it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public class ParallelExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ParallelExecutor.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ProfileRunner runner;
    private final ParallelMetrics metrics;
    private final RetryManager retryManager;
    private final ExecutorService slotExecutor;
    private final ScheduledExecutorService retryTimer;
    private final CopyOnWriteArrayList<ParallelEventListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // Guarded by lock
    private final ExecutionQueue<Profile> queue;
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final List<CompletedRun> completed = new ArrayList<>();
    private final List<FailedRun> failed = new ArrayList<>();
    private final Map<String, ScheduledFuture<?>> pendingRetries = new HashMap<>();
    private boolean running;
    private boolean paused;
    private boolean shutdown;
    private int generation;
    private long startTime;
    private Workflow workflow;

    private volatile ParallelOptions options;

    public ParallelExecutor(WorkflowEngine engine, ProfileSessionProvider sessionProvider, ParallelOptions options) {
        this(new ProfileRunner(engine, sessionProvider), options, ParallelMetrics.getInstance());
    }

    public ParallelExecutor(ProfileRunner runner, ParallelOptions options, ParallelMetrics metrics) {
        this.runner = Objects.requireNonNull(runner, "Profile runner cannot be null");
        this.options = Objects.requireNonNull(options, "Parallel options cannot be null");
        this.metrics = metrics;
        this.retryManager = new RetryManager(options.getRetryPolicy());
        this.queue = new ExecutionQueue<>(options.getQueueMode(), Profile::id);
        this.slotExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "convoy-slot-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "convoy-retry-timer");
            t.setDaemon(true);
            return t;
        });

        logger.info("ParallelExecutor initialized with {} max concurrent slots", options.getMaxConcurrent());
    }

    /**
     * Register a listener for the next run. All listeners are released when a run completes.
     */
    public Subscription subscribe(ParallelEventListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Queue one item per profile and dispatch until every profile has finished or the
     * run is stopped. Blocks the calling thread.
     *
     * @return the final status
     * @throws IllegalStateException if a run is already in progress or the executor is shut down
     */
    public ParallelStatus start(Workflow workflow, Collection<Profile> profiles) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        Objects.requireNonNull(profiles, "Profiles cannot be null");

        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("Parallel executor is shutdown");
            }
            if (running) {
                throw new IllegalStateException("Executor is already running");
            }
            this.workflow = workflow;
            this.running = true;
            this.paused = false;
            this.generation++;
            this.startTime = System.currentTimeMillis();
            completed.clear();
            failed.clear();
            slots.clear();
            queue.clear();
            queue.setMode(options.getQueueMode());
            for (Profile profile : profiles) {
                queue.add(profile.id(), profile, profile.priority());
            }
        } finally {
            lock.unlock();
        }

        logger.info("Starting parallel run of workflow {} over {} profiles (max {} concurrent)",
                workflow.getId(), profiles.size(), options.getMaxConcurrent());
        emit(new ParallelEvent.Started(workflow.getId(), workflow.getName(), profiles.size(),
                options.getMaxConcurrent()));

        dispatch();

        ParallelStatus status = getStatus();
        logger.info("Parallel run of workflow {} finished: {} completed, {} failed",
                workflow.getId(), status.completedCount(), status.failedCount());
        emit(new ParallelEvent.Completed(status));
        listeners.clear();
        return status;
    }

    private void dispatch() {
        long lastSlotStart = 0;
        lock.lock();
        try {
            while (running && (!queue.isEmpty() || !slots.isEmpty() || !pendingRetries.isEmpty())) {
                ParallelOptions current = options;
                if (paused) {
                    changed.await(current.getPausePollMs(), TimeUnit.MILLISECONDS);
                    continue;
                }
                if (slots.size() < current.getMaxConcurrent() && !queue.isEmpty()) {
                    long wait = lastSlotStart + current.getDelayBetweenMs() - System.currentTimeMillis();
                    if (lastSlotStart > 0 && wait > 0) {
                        changed.await(wait, TimeUnit.MILLISECONDS);
                        continue;
                    }
                    QueueItem<Profile> item = queue.next().orElse(null);
                    if (item != null) {
                        Slot slot = new Slot(item, workflow.getSteps().size());
                        slots.put(slot.getSlotId(), slot);
                        slotExecutor.execute(() -> runSlot(slot));
                        lastSlotStart = System.currentTimeMillis();
                    }
                    continue;
                }
                changed.await(current.getPausePollMs(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Parallel dispatcher interrupted, stopping run");
            stop();
        } finally {
            running = false;
            paused = false;
            lock.unlock();
        }
    }

    private void runSlot(Slot slot) {
        Profile profile = slot.getProfile();
        Workflow target = workflow;
        emit(new ParallelEvent.SlotStarted(slot.getSlotId(), profile));
        if (metrics != null) {
            metrics.recordSlotStarted(target.getId());
        }
        logger.info("Slot {} started for profile {} (attempt {})",
                slot.getSlotId(), profile.id(), slot.getItem().getRetryCount() + 1);

        Execution execution = null;
        String error = null;
        try {
            ProfileSession session = runner.openSession(profile);
            if (slot.attach(session)) {
                execution = runner.run(target, profile, session, slot.getExecutionId(),
                        options.getTimeoutMs(), (executionId, progress) -> onProgress(slot, progress));
                if (execution.getStatus() != ExecutionStatus.COMPLETED) {
                    error = execution.getError().orElse("Workflow " + execution.getStatus().getValue());
                }
            } else {
                runner.release(session, profile.id());
                error = "Execution stopped";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "Execution interrupted";
        } catch (Exception e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.debug("Slot {} raised", slot.getSlotId(), e);
        } finally {
            runner.release(slot.release(), profile.id());
            if (metrics != null) {
                metrics.recordSlotEnded();
            }
        }

        finishSlot(slot, execution, error);
    }

    private void onProgress(Slot slot, StepProgress progress) {
        slot.update(progress);
        emit(new ParallelEvent.Progress(slot.getSlotId(), slot.getProfile(), progress));
    }

    private void finishSlot(Slot slot, Execution execution, String error) {
        Profile profile = slot.getProfile();
        QueueItem<Profile> item = slot.getItem();
        long duration = slot.elapsedMs();
        List<ParallelEvent> events = new ArrayList<>();
        boolean stopRun = false;

        lock.lock();
        try {
            if (slots.remove(slot.getSlotId()) == null) {
                logger.debug("Slot {} ended after its run was stopped", slot.getSlotId());
            } else if (error == null) {
                completed.add(new CompletedRun(profile.id(), profile.name(), execution, duration));
                events.add(new ParallelEvent.SlotSucceeded(slot.getSlotId(), profile, execution));
                if (metrics != null) {
                    metrics.recordSlotSucceeded(workflow.getId(), duration / 1000.0);
                }
                logger.info("Slot {} completed profile {} in {}ms", slot.getSlotId(), profile.id(), duration);
            } else {
                String originalError = slot.isSkipped() ? "Skipped by user" : error;
                FailedRun.FailedStep failedStep = failedStepOf(slot);
                String detailed = String.format("[Step %d/%d: %s] %s", failedStep.index() + 1,
                        slot.getTotalSteps(), displayName(failedStep), originalError);

                if (!slot.isSkipped() && running && retryManager.shouldRetry(originalError, item.getRetryCount())) {
                    long delay = retryManager.getDelay(item.getRetryCount());
                    QueueItem<Profile> retry = item.withRetry();
                    scheduleRetry(slot.getSlotId(), retry, delay);
                    events.add(new ParallelEvent.SlotRetrying(slot.getSlotId(), profile, detailed, failedStep,
                            retry.getRetryCount(), delay));
                    if (metrics != null) {
                        metrics.recordSlotRetried(workflow.getId());
                    }
                    logger.warn("Profile {} failed, retry {} in {}ms: {}",
                            profile.id(), retry.getRetryCount(), delay, detailed);
                } else {
                    failed.add(new FailedRun(profile.id(), profile.name(), detailed, originalError, failedStep,
                            item.getRetryCount(), duration));
                    events.add(new ParallelEvent.SlotFailed(slot.getSlotId(), profile, detailed, failedStep));
                    if (metrics != null) {
                        metrics.recordSlotFailed(workflow.getId(), duration / 1000.0);
                    }
                    logger.error("Profile {} failed: {}", profile.id(), detailed);
                    stopRun = running && options.isStopOnError();
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        events.add(new ParallelEvent.SlotEnded(slot.getSlotId(), profile));
        events.forEach(this::emit);
        if (stopRun) {
            logger.info("Stopping parallel run after failure of profile {}", profile.id());
            stop();
        }
    }

    // Called with the lock held
    private void scheduleRetry(String key, QueueItem<Profile> retry, long delay) {
        int runGeneration = generation;
        ScheduledFuture<?> future = retryTimer.schedule(() -> requeue(key, retry, runGeneration),
                delay, TimeUnit.MILLISECONDS);
        pendingRetries.put(key, future);
    }

    private void requeue(String key, QueueItem<Profile> retry, int runGeneration) {
        lock.lock();
        try {
            if (runGeneration != generation || pendingRetries.remove(key) == null) {
                return;
            }
            if (running) {
                queue.add(retry);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    private FailedRun.FailedStep failedStepOf(Slot slot) {
        StepProgress progress = slot.getLastProgress();
        Step step = progress != null ? progress.step()
                : workflow.getSteps().isEmpty() ? null : workflow.getSteps().get(0);
        int index = progress != null ? progress.currentStep() - 1 : 0;
        if (step == null) {
            return new FailedRun.FailedStep(index, "", "", "");
        }
        return new FailedRun.FailedStep(index, step.getId(),
                step.getName() != null ? step.getName() : "", step.getType());
    }

    private static String displayName(FailedRun.FailedStep step) {
        return !step.name().isEmpty() ? step.name() : step.id();
    }

    public boolean pause() {
        lock.lock();
        try {
            if (!running || paused) {
                return false;
            }
            paused = true;
        } finally {
            lock.unlock();
        }
        logger.info("Parallel run paused");
        emit(new ParallelEvent.Paused());
        return true;
    }

    public boolean resume() {
        lock.lock();
        try {
            if (!running || !paused) {
                return false;
            }
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("Parallel run resumed");
        emit(new ParallelEvent.Resumed());
        return true;
    }

    /**
     * Halt dispatching, cancel every active run and close its session. Profiles released this
     * way are recorded neither as completed nor as failed.
     */
    public boolean stop() {
        List<Slot> released;
        lock.lock();
        try {
            if (!running) {
                return false;
            }
            running = false;
            paused = false;
            released = new ArrayList<>(slots.values());
            slots.clear();
            pendingRetries.values().forEach(future -> future.cancel(false));
            pendingRetries.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        for (Slot slot : released) {
            runner.cancel(slot.getExecutionId());
            runner.release(slot.release(), slot.getProfile().id());
        }
        logger.info("Parallel run stopped, released {} active slots", released.size());
        emit(new ParallelEvent.Stopped());
        return true;
    }

    /**
     * Cancel one active slot. Its profile is recorded as failed with "Skipped by user" and is not retried.
     */
    public boolean skipSlot(String slotId) {
        Slot slot;
        lock.lock();
        try {
            slot = slots.get(slotId);
            if (slot == null) {
                return false;
            }
            slot.markSkipped();
        } finally {
            lock.unlock();
        }

        runner.cancel(slot.getExecutionId());
        runner.release(slot.release(), slot.getProfile().id());
        logger.info("Skipped slot {} for profile {}", slotId, slot.getProfile().id());
        emit(new ParallelEvent.SlotSkipped(slotId));
        return true;
    }

    /**
     * Queue more profiles into the current run.
     *
     * @throws IllegalStateException if no run is in progress
     */
    public void addProfiles(Collection<Profile> profiles) {
        int size;
        lock.lock();
        try {
            if (!running) {
                throw new IllegalStateException("Executor is not running");
            }
            for (Profile profile : profiles) {
                queue.add(profile.id(), profile, profile.priority());
            }
            size = queue.size();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        emit(new ParallelEvent.QueueUpdated(size));
    }

    public boolean removeFromQueue(String profileId) {
        int removed;
        int size;
        lock.lock();
        try {
            removed = queue.removeByPayloadKey(profileId);
            size = queue.size();
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            emit(new ParallelEvent.QueueUpdated(size));
        }
        return removed > 0;
    }

    /**
     * Replace the options. Concurrency, stagger, stop-on-error and queue mode take effect at the next
     * dispatch; a changed retry policy applies to failures from now on.
     */
    public void updateConfig(ParallelOptions newOptions) {
        Objects.requireNonNull(newOptions, "Parallel options cannot be null");
        lock.lock();
        try {
            this.options = newOptions;
            queue.setMode(newOptions.getQueueMode());
            retryManager.updatePolicy(newOptions.getRetryPolicy());
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("Parallel options updated: {}", newOptions);
    }

    public ParallelStatus getStatus() {
        lock.lock();
        try {
            int finished = completed.size() + failed.size();
            int total = finished + queue.size() + slots.size() + pendingRetries.size();
            long elapsed = startTime > 0 ? System.currentTimeMillis() - startTime : 0;
            long eta = 0;
            if (finished > 0 && total > finished) {
                eta = elapsed / finished * (total - finished);
            }
            int progress = total > 0 ? (int) Math.round(finished * 100.0 / total) : 0;

            List<SlotSnapshot> slotViews = slots.values().stream().map(Slot::snapshot).toList();
            List<QueuedProfile> queued = queue.getAll().stream()
                    .map(item -> new QueuedProfile(item.getId(), item.getPayload().id(), item.getPayload().name(),
                            item.getPriority(), item.getRetryCount()))
                    .toList();

            return new ParallelStatus(running, paused, total, completed.size(), failed.size(), queue.size(),
                    slots.size(), pendingRetries.size(), progress, elapsed, eta,
                    slotViews, completed, failed, queued);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    public ParallelOptions getOptions() {
        return options;
    }

    /**
     * Stop any run and release the executor's threads.
     */
    public void shutdown() {
        stop();
        lock.lock();
        try {
            shutdown = true;
        } finally {
            lock.unlock();
        }
        retryTimer.shutdownNow();
        slotExecutor.shutdown();
        try {
            if (!slotExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Slot threads did not finish, forcing shutdown");
                slotExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slotExecutor.shutdownNow();
        }
    }

    private void emit(ParallelEvent event) {
        for (ParallelEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Parallel event listener failed on {}: {}", event.getClass().getSimpleName(),
                        e.getMessage());
            }
        }
    }
}
