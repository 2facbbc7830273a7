package com.delayq;

import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Performs jobs of one type. Implementations must be Spring beans to be picked up by
 * the poller.
 *
 * @param <T> payload type, deserialized from the job's JSON payload
 */
public interface JobWorker<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * The job type this worker performs. Must be unique across workers.
     */
    String getJobType();

    /**
     * Performs one job. Throwing marks the attempt as failed; the job is retried later
     * or, once attempts run out, marked failed.
     */
    void perform(UUID jobId, T payload) throws Exception;

    /**
     * Payload class used for deserialization. Inferred from {@code JobWorker<T>} by default.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        return (Class<T>) PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobWorker::inferPayloadClass);
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobWorker.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " payload type cannot be inferred. Use a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
