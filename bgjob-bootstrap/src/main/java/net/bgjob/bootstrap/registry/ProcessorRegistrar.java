package net.bgjob.bootstrap.registry;

import net.bgjob.core.service.JobProcessor;
import net.bgjob.core.service.ProcessorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * 컨텍스트의 JobProcessor 빈을 전부 레지스트리에 바인딩한다.
 * 싱글톤 생성이 끝난 직후, 라이프사이클(스케줄러 시작)보다 먼저 실행된다.
 */
public class ProcessorRegistrar implements SmartInitializingSingleton {
    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistrar.class);

    private final ProcessorRegistry registry;
    private final ObjectProvider<JobProcessor> processors;

    public ProcessorRegistrar(ProcessorRegistry registry, ObjectProvider<JobProcessor> processors) {
        this.registry = registry;
        this.processors = processors;
    }

    @Override
    public void afterSingletonsInstantiated() {
        processors.orderedStream().forEach(registry::register);
        var types = registry.listRegisteredTypes();
        if (types.isEmpty()) {
            log.warn("No JobProcessor beans found, every claimed job will fail as unknown type");
        } else {
            log.info("Processors bound: {}", types);
        }
    }
}
