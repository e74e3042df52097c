package net.bgjob.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bgjob.adapter.jdbc.repo.JdbcJobStore;
import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;
import net.bgjob.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class BgJobSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 저장소 구현 등록 (adapter-jdbc 재사용)
    @Bean
    public JobStore jobStore(ObjectMapper objectMapper, Clock clock) {
        return new JdbcJobStore(objectMapper, clock);
    }

    @Bean
    public Clock systemClock() { return Clock.system(); }
}
