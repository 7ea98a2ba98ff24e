package com.tidypipe.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.tidypipe.backend.source.DataSource;
import com.tidypipe.backend.source.InMemoryDataSource;

@Configuration
public class EngineConfiguration {

    /**
     * 所有会话共享的只读数据源
     */
    @Bean
    public DataSource dataSource() {
        return InMemoryDataSource.withBuiltins();
    }
}
