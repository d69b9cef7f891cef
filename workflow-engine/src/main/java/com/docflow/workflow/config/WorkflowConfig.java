package com.docflow.workflow.config;

import com.docflow.workflow.gateway.IdentityProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class WorkflowConfig {

    /** Engine-wide time source; tests pass a fixed clock instead. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
