package org.carball.tuner.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.run.OptimizationRun;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Triggers an optimization run at start-up and then once a day at a fixed local time.
 */
@Slf4j
public class OptimizationScheduler {

    private static final Pattern DAILY_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");
    private static final Pattern DAILY_CRON = Pattern.compile("(\\d{1,2})\\s+(\\d{1,2})\\s+\\*\\s+\\*\\s+\\*");

    private final OptimizationOrchestrator orchestrator;
    private final LocalTime runAt;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private volatile Consumer<OptimizationRun> runListener = run -> { };

    public OptimizationScheduler(OptimizationOrchestrator orchestrator, String schedule) {
        this(orchestrator, parseDailyTime(schedule), Clock.systemDefaultZone());
    }

    public OptimizationScheduler(OptimizationOrchestrator orchestrator, LocalTime runAt, Clock clock) {
        this.orchestrator = orchestrator;
        this.runAt = runAt;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "optimization-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs immediately, then daily at the configured time.
     */
    public void start() {
        log.info("Starting optimization scheduler, daily run at {}", runAt);
        executor.execute(this::trigger);
        scheduleNext();
    }

    public void stop() {
        log.info("Stopping optimization scheduler");
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Optimization run did not finish within 30 seconds of shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Receives every completed run; skipped triggers are not reported.
     */
    public void onRunCompleted(Consumer<OptimizationRun> listener) {
        this.runListener = listener;
    }

    public LocalTime getRunAt() {
        return runAt;
    }

    private void scheduleNext() {
        if (executor.isShutdown()) {
            return;
        }
        Duration delay = delayUntilNext(runAt, ZonedDateTime.now(clock));
        log.debug("Next optimization run in {}", delay);
        try {
            executor.schedule(() -> {
                trigger();
                scheduleNext();
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler stopped, next run not scheduled");
        }
    }

    private void trigger() {
        try {
            orchestrator.runOnce().ifPresent(runListener);
        } catch (RuntimeException e) {
            log.error("Scheduled optimization run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Accepts {@code HH:mm} or a five-field cron expression with a fixed minute and hour
     * ({@code "0 2 * * *"}).
     *
     * @throws IllegalArgumentException for any other expression
     */
    public static LocalTime parseDailyTime(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("Schedule must not be empty");
        }

        String trimmed = schedule.trim();
        Matcher time = DAILY_TIME.matcher(trimmed);
        if (time.matches()) {
            return toLocalTime(Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)), schedule);
        }

        Matcher cron = DAILY_CRON.matcher(trimmed);
        if (cron.matches()) {
            return toLocalTime(Integer.parseInt(cron.group(2)), Integer.parseInt(cron.group(1)), schedule);
        }

        throw new IllegalArgumentException("Unsupported schedule '" + schedule
                + "': use HH:mm or a daily cron expression such as '0 2 * * *'");
    }

    /**
     * Time from {@code now} until the next occurrence of {@code runAt}. A run due exactly now is
     * scheduled for the following day.
     */
    public static Duration delayUntilNext(LocalTime runAt, ZonedDateTime now) {
        ZonedDateTime next = now.with(runAt).truncatedTo(ChronoUnit.MINUTES);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    private static LocalTime toLocalTime(int hour, int minute, String schedule) {
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("Schedule out of range: " + schedule);
        }
        return LocalTime.of(hour, minute);
    }
}
