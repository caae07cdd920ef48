package com.bat.config;

import com.bat.core.agent.CapabilityResolver;
import com.bat.core.llm.OracleResponseDecoder;
import com.bat.core.logging.Slf4jTaskLogger;
import com.bat.core.metrics.BatMetrics;
import com.bat.core.task.TaskExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BatConfig {

    @Bean
    public CapabilityResolver capabilityResolver(OracleResponseDecoder decoder, ObjectMapper objectMapper,
                                                 BatMetrics metrics) {
        return new CapabilityResolver(decoder, objectMapper, metrics);
    }

    @Bean
    public Slf4jTaskLogger taskLogger(BatProperties properties) {
        return new Slf4jTaskLogger(properties.getLogging().getHistorySize());
    }

    @Bean(destroyMethod = "close")
    public TaskExecutor taskExecutor(Slf4jTaskLogger taskLogger, BatMetrics metrics, BatProperties properties) {
        return new TaskExecutor(taskLogger, metrics, properties.getDelegation().getMaxDepth());
    }
}
