package com.delayq.internal;

import com.delayq.JobClient;
import com.delayq.JobRepository;
import com.delayq.JobWorker;
import com.delayq.Recurrence;
import com.delayq.annotation.Recurring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.UUID;

/**
 * Makes sure every worker annotated with {@link Recurring} has a recurring job queued.
 */
@Component
public class RecurringJobInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecurringJobInitializer.class);
    private static final String UNIQUE_KEY_PREFIX = "__delayq_recurring__:";

    private final JobRepository jobRepository;
    private final JobClient jobClient;
    private final List<JobWorker<?>> workers;
    private boolean running = false;

    public RecurringJobInitializer(JobRepository jobRepository, JobClient jobClient, List<JobWorker<?>> workers) {
        this.jobRepository = jobRepository;
        this.jobClient = jobClient;
        this.workers = workers;
    }

    @Override
    public void start() {
        for (JobWorker<?> worker : workers) {
            Recurring recurring = AnnotationUtils.findAnnotation(ClassUtils.getUserClass(worker), Recurring.class);
            if (recurring != null) {
                bootstrap(worker.getJobType(), recurring);
            }
        }
        this.running = true;
    }

    private void bootstrap(String type, Recurring recurring) {
        try {
            if (jobRepository.existsByTypeAndFailedAtIsNull(type)) {
                log.debug("Recurring job {} is already queued", type);
                return;
            }
            Recurrence recurrence = new Recurrence(recurring.periodSeconds(), recurring.at(), null);
            UUID jobId = jobClient.scheduleRecurring(type, null, recurring.priority(), recurrence,
                    uniqueKeyFor(type));
            log.info("Bootstrapped recurring job {} as {}", type, jobId);
        } catch (DataIntegrityViolationException alreadyBootstrapped) {
            log.debug("Skipped duplicate recurring bootstrap for type {}; another worker created it", type);
        } catch (Exception e) {
            log.error("Failed to bootstrap recurring job {} (period {}s, at '{}')", type, recurring.periodSeconds(),
                    recurring.at(), e);
        }
    }

    static String uniqueKeyFor(String type) {
        return UNIQUE_KEY_PREFIX + type;
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }
}
