package com.logicsynth.facts;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FactsConfiguration {

    @Bean
    public FactStore factStore(@Value("${logicsynth.facts.limit:100000}") int limit) {
        return new InMemoryFactStore(limit);
    }
}
