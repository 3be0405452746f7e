package com.yerin.bookpipe.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class BookpipeMetrics {

    private final MeterRegistry registry;

    private final Counter jobSubmitted;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter stageRetried;
    private final Counter jobReclaimed;
    private final Counter jobCancelled;

    public BookpipeMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobSubmitted = Counter.builder("bookpipe_jobs_submitted_total")
                .description("jobs submitted").register(registry);
        this.jobSucceeded = Counter.builder("bookpipe_jobs_succeeded_total")
                .description("jobs succeeded").register(registry);
        this.jobFailed    = Counter.builder("bookpipe_jobs_failed_total")
                .description("jobs terminally failed").register(registry);
        this.stageRetried = Counter.builder("bookpipe_stage_retried_total")
                .description("stage failures scheduled for retry").register(registry);
        this.jobReclaimed = Counter.builder("bookpipe_jobs_reclaimed_total")
                .description("running jobs reclaimed after lease expiry").register(registry);
        this.jobCancelled = Counter.builder("bookpipe_jobs_cancelled_total")
                .description("jobs cancelled before dispatch").register(registry);
    }

    public void incSubmitted() { jobSubmitted.increment(); }
    public void incSucceeded() { jobSucceeded.increment(); }
    public void incFailed()    { jobFailed.increment(); }
    public void incRetried()   { stageRetried.increment(); }
    public void incReclaimed() { jobReclaimed.increment(); }
    public void incCancelled() { jobCancelled.increment(); }

    public Timer stageTimer(String stage) {
        return Timer.builder("bookpipe_stage_duration_seconds")
                .description("stage duration by name")
                .tag("stage", stage)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
