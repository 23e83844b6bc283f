package com.lab2fhir.config;

import com.lab2fhir.domain.LabDataPayloadValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    /**
     * Clock for metadata timestamps and the "collected in the future" check. Never feeds identifiers.
     */
    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LabDataPayloadValidator labDataPayloadValidator(Clock pipelineClock) {
        return new LabDataPayloadValidator(pipelineClock);
    }

    /**
     * Each pipeline step commits on its own so a failure can still be recorded on the report.
     */
    @Bean
    public TransactionTemplate pipelineTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
