package net.bgjob.core.error;

import net.bgjob.core.model.JobType;

public class UnknownJobTypeException extends RuntimeException {
    private final JobType type;

    public UnknownJobTypeException(JobType type) {
        super("No processor registered for job type '" + type.code() + "'");
        this.type = type;
    }

    public JobType getType() { return type; }
}
