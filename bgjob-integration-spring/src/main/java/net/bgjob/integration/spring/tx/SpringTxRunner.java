package net.bgjob.integration.spring.tx;

import net.bgjob.adapter.jdbc.TxContext;
import net.bgjob.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션의 물리 커넥션을 TxContext에 꽂아 JdbcJobStore가 같은 트랜잭션에서 동작하게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // REQUIRED 중첩 호출은 바깥 커넥션을 그대로 쓴다
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                // 새 트랜잭션의 커넥션으로 교체하고, 끝나면 바깥 커넥션 복원
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (outer != null) TxContext.set(outer); else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    /** TransactionTemplate 콜백을 통과시키기 위한 래퍼. 롤백 후 원래 예외로 풀어서 던진다 */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override
        public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}
