package net.bgjob.core.model;

import java.util.Optional;

/**
 * 작업 종류. 어떤 Processor가 처리할지, payload를 어떻게 해석할지를 결정한다.
 * {@code code}는 저장소 컬럼에 들어가는 고정 문자열이다.
 */
public enum JobType {
    GENERIC_LLM_STREAM("generic_llm_stream", 3),
    VOICE_TRANSCRIPTION("voice_transcription", 2),
    REGEX_GENERATION("regex_generation", 3),
    PATH_CORRECTION("path_correction", 3),
    IMPLEMENTATION_PLAN("implementation_plan", 1),
    TEXT_IMPROVEMENT("text_improvement", 3),
    GUIDANCE_GENERATION("guidance_generation", 3),
    PATH_FINDER("path_finder", 3),
    TASK_REFINEMENT("task_refinement", 3);

    private final String code;
    private final int defaultMaxRetries;

    JobType(String code, int defaultMaxRetries) {
        this.code = code;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public String code() { return code; }

    /** 재시도 상한 기본값 (첫 실행은 포함하지 않음) */
    public int defaultMaxRetries() { return defaultMaxRetries; }

    public static Optional<JobType> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String c = code.trim();
        for (JobType t : values()) {
            if (t.code.equalsIgnoreCase(c) || t.name().equalsIgnoreCase(c)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
