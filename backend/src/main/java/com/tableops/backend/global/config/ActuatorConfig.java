package com.tableops.backend.global.config;

import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Backs {@code /actuator/httpexchanges}. Keeps the last {@code capacity} exchanges in memory only.
 */
@Configuration
public class ActuatorConfig {

    private static final int EXCHANGE_CAPACITY = 200;

    @Bean
    public HttpExchangeRepository httpExchangeRepository() {
        InMemoryHttpExchangeRepository repository = new InMemoryHttpExchangeRepository();
        repository.setCapacity(EXCHANGE_CAPACITY);
        return repository;
    }
}
