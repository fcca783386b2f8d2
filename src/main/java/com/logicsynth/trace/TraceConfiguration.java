package com.logicsynth.trace;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TraceConfiguration {

    /**
     * Depth ceiling for proof trees. Values above {@link DerivationTracer#HARD_CEILING} are capped.
     */
    @Bean
    public DerivationTracer derivationTracer(@Value("${logicsynth.trace.max-depth:10}") int maxDepth) {
        return new DerivationTracer(maxDepth);
    }
}
