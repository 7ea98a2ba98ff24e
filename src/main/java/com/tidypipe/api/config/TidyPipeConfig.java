package com.tidypipe.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.tidypipe.backend.engine.EngineConfig;

@ConfigurationProperties(prefix = "tidypipe.engine")
public class TidyPipeConfig {

    /**
     * 日期字段提取、无时区文本解析使用的时区
     */
    private String zone = "UTC";

    /**
     * 随机变量的种子，不配置则每个会话随机
     */
    private Long randomSeed;

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

    public EngineConfig toEngineConfig() {
        EngineConfig config = new EngineConfig();
        config.setZone(zone);
        config.setRandomSeed(randomSeed);
        return config;
    }
}
