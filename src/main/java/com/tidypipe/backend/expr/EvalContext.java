package com.tidypipe.backend.expr;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Random;

/**
 * 求值环境：日期字段提取使用的时区，以及随机变量使用的随机源。
 */
public class EvalContext {

    private final ZoneId zone;
    private final Random random;

    public EvalContext(ZoneId zone, Random random) {
        this.zone = zone;
        this.random = random;
    }

    public static EvalContext defaults() {
        return new EvalContext(ZoneOffset.UTC, new Random());
    }

    public ZoneId getZone() {
        return zone;
    }

    public Random getRandom() {
        return random;
    }
}
