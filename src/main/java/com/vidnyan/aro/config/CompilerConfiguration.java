package com.vidnyan.aro.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans the compiler components need but do not declare themselves.
 */
@Configuration
public class CompilerConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * Indented output, map entries sorted by key.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
