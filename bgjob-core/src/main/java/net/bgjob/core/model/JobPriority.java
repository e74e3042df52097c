package net.bgjob.core.model;

/** 자주 쓰는 우선순위 값. 큰 값이 먼저 나간다. */
public final class JobPriority {
    private JobPriority() {}

    public static final int HIGH = 10;
    public static final int NORMAL = 0;
    public static final int LOW = -10;
}
