package com.cw.contentflow.config;

import com.cw.contentflow.trace.LogCaptureAppender;
import com.cw.contentflow.trace.LogStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LogFabricConfig {

    @Bean
    public LogStore logStore(ContentFlowProperties properties) {
        return new LogStore(properties.getLogs().getCapacity());
    }

    @Bean(initMethod = "attach", destroyMethod = "detach")
    public LogCaptureAppender logCaptureAppender(LogStore logStore) {
        return new LogCaptureAppender(logStore);
    }
}
