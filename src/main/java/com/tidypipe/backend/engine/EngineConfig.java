package com.tidypipe.backend.engine;

import java.time.ZoneId;
import java.util.Random;

import com.tidypipe.backend.expr.EvalContext;

/**
 * 引擎配置：日期字段提取使用的时区、随机数种子。
 * <p>
 * 控制台从 JVM 系统属性读取（{@code tidypipe.engine.zone} / {@code tidypipe.engine.random-seed}），
 * HTTP 服务由 Spring 绑定同名配置项后转换为本对象。
 */
public class EngineConfig {

    public static final String ZONE_PROPERTY = "tidypipe.engine.zone";
    public static final String SEED_PROPERTY = "tidypipe.engine.random-seed";

    private String zone = "UTC";

    /** 为空表示不固定种子 */
    private Long randomSeed;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromSystemProperties() {
        EngineConfig config = new EngineConfig();
        String zone = System.getProperty(ZONE_PROPERTY);
        if(zone != null && !zone.isBlank()) {
            config.setZone(zone.trim());
        }
        String seed = System.getProperty(SEED_PROPERTY);
        if(seed != null && !seed.isBlank()) {
            config.setRandomSeed(Long.parseLong(seed.trim()));
        }
        return config;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public EvalContext newEvalContext() {
        Random random = randomSeed == null ? new Random() : new Random(randomSeed);
        return new EvalContext(zoneId(), random);
    }
}
