package com.tidypipe.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.tidypipe.api")
@ConfigurationPropertiesScan(basePackages = "com.tidypipe.api")
public class TidyPipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TidyPipeApplication.class, args);
    }
}
