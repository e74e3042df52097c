package net.bgjob.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 저장소 호출은 항상 이 안에서 실행된다.
 * 구현: JDBC 직접 관리(JdbcTxRunner) 또는 스프링 트랜잭션 브리지(SpringTxRunner).
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션과 무관하게 항상 새 트랜잭션 (클레임처럼 즉시 커밋돼야 하는 작업용) */
    <T> T requiresNew(Callable<T> body) throws Exception;

    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }
}
