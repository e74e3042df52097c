package net.bgjob.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.core.model.JobType;
import net.bgjob.core.model.ProcessResult;

/**
 * 작업 종류별 실행기 계약.
 * <p>
 * payload에는 항상 {@code jobId}가 들어 있으므로 구현체는 {@link JobUpdater}로 자기 행의 진행 상황을 직접 갱신한다.
 * 코어는 진행률을 대신 추정하지 않는다. 입력이 잘못된 경우 {@code JobValidationException}을 던지면 재시도되지 않는다.
 */
public interface JobProcessor {

    /** 이 구현체가 담당하는 작업 종류 (자동 등록 시 사용) */
    JobType type();

    ProcessResult process(JsonNode payload) throws Exception;
}
