package net.bgjob.adapter.jdbc;

import java.sql.Connection;

/**
 * 현재 스레드의 트랜잭션 커넥션. TxRunner가 꽂아 주고 JdbcJobStore가 꺼내 쓴다.
 */
public final class TxContext {
    private static final ThreadLocal<Connection> CURRENT = new ThreadLocal<>();

    private TxContext() {}

    public static Connection get() { return CURRENT.get(); }

    public static void set(Connection c) { CURRENT.set(c); }

    public static void clear() { CURRENT.remove(); }

    /** 바깥 커넥션을 잠시 치우고 새 커넥션으로 대체, 반환값으로 복원한다 */
    static Connection swap(Connection c) {
        Connection prev = CURRENT.get();
        if (c == null) CURRENT.remove(); else CURRENT.set(c);
        return prev;
    }
}
