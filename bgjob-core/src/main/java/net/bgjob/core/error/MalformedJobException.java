package net.bgjob.core.error;

/** 클레임된 행에 type/payload가 없거나 해석 불가 */
public class MalformedJobException extends JobValidationException {
    private final String jobId;

    public MalformedJobException(String jobId, String reason) {
        super("Malformed job " + jobId + ": " + reason);
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
