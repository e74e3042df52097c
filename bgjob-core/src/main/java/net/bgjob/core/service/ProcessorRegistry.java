package net.bgjob.core.service;

import net.bgjob.core.error.UnknownJobTypeException;
import net.bgjob.core.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 작업 종류 → Processor 바인딩. 등록은 기동 시 한 번, 스케줄러가 폴링을 시작하기 전에 끝난다.
 */
public final class ProcessorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private final Map<JobType, JobProcessor> processors = new ConcurrentHashMap<>();

    /** 같은 종류를 다시 등록하면 이전 바인딩을 덮어쓴다 (WARN 로그) */
    public void register(JobType type, JobProcessor processor) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(processor, "processor");
        JobProcessor prev = processors.put(type, processor);
        if (prev != null && prev != processor) {
            log.warn("Processor for job type '{}' replaced: {} -> {}",
                    type.code(), prev.getClass().getName(), processor.getClass().getName());
        } else {
            log.info("Processor registered: type='{}' impl={}", type.code(), processor.getClass().getName());
        }
    }

    public void register(JobProcessor processor) {
        register(processor.type(), processor);
    }

    public Optional<JobProcessor> getProcessor(JobType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(processors.get(type));
    }

    public JobProcessor requireProcessor(JobType type) {
        return getProcessor(type).orElseThrow(() -> new UnknownJobTypeException(type));
    }

    public boolean hasProcessor(JobType type) {
        return type != null && processors.containsKey(type);
    }

    public List<JobType> listRegisteredTypes() {
        var out = new ArrayList<>(processors.keySet());
        out.sort(Comparator.naturalOrder());
        return out;
    }
}
