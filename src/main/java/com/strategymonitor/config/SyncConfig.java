package com.strategymonitor.config;

import com.strategymonitor.sync.ChangeDebouncer;
import com.strategymonitor.sync.LoggingRemoteSyncClient;
import com.strategymonitor.sync.RemoteSyncClient;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncConfig {

    @Bean(destroyMethod = "shutdown")
    public ChangeDebouncer changeDebouncer(
            MonitorProperties monitorProperties, @Qualifier("eventExecutor") Executor eventExecutor) {
        return new ChangeDebouncer(Duration.ofMillis(monitorProperties.getSync().getQuietPeriodMs()), eventExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(RemoteSyncClient.class)
    public RemoteSyncClient remoteSyncClient() {
        return new LoggingRemoteSyncClient();
    }
}
