package org.geoserve.server.spring.config;

import org.geoserve.server.json.JacksonMapper;
import org.geoserve.server.json.ObjectMapperProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApplicationConfiguration {

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
