package net.bgjob.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Processor 실행 결과 */
public record ProcessResult(boolean success, String message, JsonNode data, Throwable error) {

    public static ProcessResult success(String message) {
        return new ProcessResult(true, message, null, null);
    }

    public static ProcessResult success(String message, JsonNode data) {
        return new ProcessResult(true, message, data, null);
    }

    public static ProcessResult failure(String message) {
        return new ProcessResult(false, message, null, null);
    }

    public static ProcessResult failure(String message, Throwable error) {
        return new ProcessResult(false, message, null, error);
    }
}
