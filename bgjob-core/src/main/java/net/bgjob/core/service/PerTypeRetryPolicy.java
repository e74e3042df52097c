package net.bgjob.core.service;

import net.bgjob.core.model.JobType;

import java.util.EnumMap;
import java.util.Map;

final class PerTypeRetryPolicy implements RetryPolicy {
    private final Integer defaultMax;
    private final Map<JobType, Integer> overrides;

    PerTypeRetryPolicy(Integer defaultMax, Map<JobType, Integer> overrides) {
        if (defaultMax != null && defaultMax < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.defaultMax = defaultMax;
        this.overrides = overrides.isEmpty() ? Map.of() : new EnumMap<>(overrides);
        this.overrides.forEach((t, n) -> {
            if (n == null || n < 0) throw new IllegalArgumentException("maxRetries for " + t + " must be >= 0");
        });
    }

    @Override
    public int maxRetries(JobType type) {
        Integer o = overrides.get(type);
        if (o != null) return o;
        return defaultMax != null ? defaultMax : type.defaultMaxRetries();
    }
}
