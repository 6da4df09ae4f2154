package com.example.calcmcp.config;

import com.example.calcmcp.history.InMemoryHistory;
import com.example.calcmcp.service.Calculator;
import com.example.calcmcp.service.SimpleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(HistoryProperties.class)
public class CalculatorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalculatorConfiguration.class);

    @Bean
    public Calculator calculator(HistoryProperties properties) {
        log.info("Binding calculator to history '{}' (maxEntries={})",
                properties.defaultName(), properties.maxEntries());
        return new SimpleCalculator(new InMemoryHistory(properties.maxEntries()));
    }
}
