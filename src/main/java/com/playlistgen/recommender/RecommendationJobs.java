package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Registry of background recommendation runs that callers poll by job id.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #submit(ListenerProfileProvider, int)} registers a job as STARTING and hands it to a worker pool.</li>
 *   <li>The worker marks it RUNNING, runs the engine, then stores either the {@link RunResult} (COMPLETED)
 *       or the error message (FAILED).</li>
 *   <li>{@link #status(String)} returns an immutable view of the job at the time of the call.</li>
 *   <li>{@link #cleanup(Instant)} runs on every submit and forgets finished jobs after 10 minutes
 *       and any job after an hour.</li>
 * </ul>
 * Concurrent jobs share the engine's Feature Store.
 */
public class RecommendationJobs implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationJobs.class);

    public static final Duration MAX_JOB_AGE = Duration.ofHours(1);
    public static final Duration FINISHED_JOB_RETENTION = Duration.ofMinutes(10);

    public enum Status { STARTING, RUNNING, COMPLETED, FAILED }

    /**
     * Point-in-time view of a job.
     */
    public record JobView(String id, int requested, Status status, Instant startedAt, RunResult result, String error) {}

    private static final class Job {
        private final String id;
        private final int requested;
        private final Instant startedAt;
        private volatile Status status = Status.STARTING;
        private volatile RunResult result;
        private volatile String error;

        Job(String id, int requested, Instant startedAt) {
            this.id = id;
            this.requested = requested;
            this.startedAt = startedAt;
        }

        boolean expired(Instant now) {
            Duration age = Duration.between(startedAt, now);
            if (age.compareTo(MAX_JOB_AGE) > 0) return true;
            boolean finished = status == Status.COMPLETED || status == Status.FAILED;
            return finished && age.compareTo(FINISHED_JOB_RETENTION) > 0;
        }

        JobView view() {
            return new JobView(id, requested, status, startedAt, result, error);
        }
    }

    private final RecommendationEngine engine;
    private final ExecutorService executor;
    private final Clock clock;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public RecommendationJobs(RecommendationEngine engine, int workers) {
        this(engine, workers, Clock.systemUTC());
    }

    RecommendationJobs(RecommendationEngine engine, int workers, Clock clock) {
        if (workers < 1) throw new IllegalArgumentException("At least one worker is required");
        this.engine = engine;
        this.executor = Executors.newFixedThreadPool(workers);
        this.clock = clock;
    }

    /**
     * Starts a run in the background.
     * @param provider Listener profile source
     * @param count Number of recommendations requested
     * @return job id
     */
    public String submit(ListenerProfileProvider provider, int count) {
        Instant now = clock.instant();
        cleanup(now);
        String id = UUID.randomUUID().toString();
        Job job = new Job(id, count, now);
        jobs.put(id, job);
        executor.submit(() -> execute(job, provider));
        logger.info("Submitted recommendation job {} for {} tracks", id, count);
        return id;
    }

    private void execute(Job job, ListenerProfileProvider provider) {
        job.status = Status.RUNNING;
        try {
            job.result = engine.run(provider, job.requested);
            job.status = Status.COMPLETED;
            logger.info("Job {} completed with {} recommendations", job.id, job.result.results().size());
        } catch (RecommenderException | RuntimeException e) {
            job.error = e.getMessage();
            job.status = Status.FAILED;
            logger.error("Job {} failed: {}", job.id, e.getMessage(), e);
        }
    }

    /**
     * @param jobId id returned by {@link #submit}
     * @return the job's current view, or empty for an unknown id
     */
    public Optional<JobView> status(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.view());
    }

    /**
     * Forgets jobs older than {@link #MAX_JOB_AGE}, and COMPLETED or FAILED jobs older than
     * {@link #FINISHED_JOB_RETENTION}. A forgotten job that is still running finishes normally but can no longer be polled.
     * @param now reference time
     * @return number of jobs removed
     */
    public int cleanup(Instant now) {
        int removed = 0;
        Iterator<Job> it = jobs.values().iterator();
        while (it.hasNext()) {
            if (it.next().expired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Removed {} expired recommendation job(s)", removed);
        }
        return removed;
    }

    /**
     * Waits for running jobs to finish, then stops the workers.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Recommendation jobs still running after 30s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
