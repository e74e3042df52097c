package net.bgjob.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bgjob.bootstrap.props.BgJobProperties;
import net.bgjob.bootstrap.registry.ProcessorRegistrar;
import net.bgjob.core.maintenance.LeaseMaintenanceService;
import net.bgjob.core.service.*;
import net.bgjob.core.spi.*;
import net.bgjob.integration.spring.BgJobSpringConfig;
import net.bgjob.integration.spring.sched.SchedulerLifecycle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;

@AutoConfiguration(
        after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class},
        afterName = {
                "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
                "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
        })
@ConditionalOnSingleCandidate(DataSource.class)
@EnableConfigurationProperties(BgJobProperties.class)
@Import(BgJobSpringConfig.class) // integration-spring: store/tx/clock wiring
public class BgJobAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper bgJobObjectMapper() {
        return new ObjectMapper();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ProcessorRegistry processorRegistry() {
        return new ProcessorRegistry();
    }

    @Bean
    public ProcessorRegistrar processorRegistrar(ProcessorRegistry registry, ObjectProvider<JobProcessor> processors) {
        return new ProcessorRegistrar(registry, processors);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue() {
        return new JobQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(BgJobProperties props) {
        var r = props.getRetry();
        return RetryPolicy.of(r.getDefaultMaxRetries(), r.getPerType());
    }

    @Bean
    @ConditionalOnMissingBean
    public Dispatcher dispatcher(ProcessorRegistry registry, JobStore store, TxRunner tx, RetryPolicy retry) {
        return new Dispatcher(registry, store, tx, retry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobUpdater jobUpdater(JobStore store, TxRunner tx) {
        return new JobUpdater(store, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobService jobService(JobStore store, TxRunner tx, JobQueue queue, ObjectMapper objectMapper, Clock clock) {
        return new JobService(store, tx, queue, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseMaintenanceService leaseMaintenance(JobStore store, TxRunner tx, Clock clock, BgJobProperties props) {
        return new LeaseMaintenanceService(store, tx, clock, props.getScheduler().getStaleJobTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(BgJobProperties props,
                                     JobStore store,
                                     TxRunner tx,
                                     JobQueue queue,
                                     Dispatcher dispatcher,
                                     LeaseMaintenanceService maintenance) {
        return new JobScheduler(props.getScheduler().toSettings(), store, tx, queue, dispatcher, maintenance);
    }

    // --- 스케줄러 기동 (bgjob.scheduler.enabled=false 면 등록만 하고 폴링하지 않음) ---

    @Bean
    @ConditionalOnProperty(prefix = "bgjob.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }
}
