package net.bgjob.core.service;

public record DispatchResult(String jobId, Outcome outcome, String message) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        /** 재시도 예약: 행은 queued로 돌아가고 retryCount가 증가 */
        RETRY_SCHEDULED,
        CANCELED,
        /** lease를 잃었거나 이미 취소되어 실행하지 않음 */
        SKIPPED,
        /** 저장소 오류로 상태를 확정하지 못함 */
        ERROR
    }
}
