package com.strategymonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class StrategyMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyMonitorApplication.class, args);
    }
}
