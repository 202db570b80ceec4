package com.strategymonitor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final MonitorProperties monitorProperties;

    public WebConfig(MonitorProperties monitorProperties) {
        this.monitorProperties = monitorProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(monitorProperties.getCors().getAllowedOrigin())
                .allowedMethods("*")
                .allowedHeaders("*");
    }
}
