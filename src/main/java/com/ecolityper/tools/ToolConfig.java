package com.ecolityper.tools;

import com.ecolityper.core.scheduler.DefaultThreadBudgetPolicy;
import com.ecolityper.core.scheduler.ThreadBudgetPolicy;
import com.ecolityper.runner.LocalProcessExecutor;
import com.ecolityper.runner.ProcessExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolConfig {

    @Bean
    @ConditionalOnMissingBean(ProcessExecutor.class)
    public ProcessExecutor processExecutor() {
        return new LocalProcessExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(ThreadBudgetPolicy.class)
    public ThreadBudgetPolicy threadBudgetPolicy() {
        return new DefaultThreadBudgetPolicy();
    }

    /**
     * In-process registry used when no monitoring backend contributes one. Meters stay queryable
     * for the duration of the run.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
