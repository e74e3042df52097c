package net.bgjob.core.error;

/**
 * 입력 자체가 잘못되어 재시도해도 소용없는 실패.
 * Processor가 이 예외를 던지면 재시도 없이 바로 failed 처리된다.
 */
public class JobValidationException extends RuntimeException {
    public JobValidationException(String message) { super(message); }
    public JobValidationException(String message, Throwable cause) { super(message, cause); }
}
