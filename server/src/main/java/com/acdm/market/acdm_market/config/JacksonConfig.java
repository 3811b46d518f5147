package com.acdm.market.acdm_market.config;

import java.math.BigInteger;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * Base-unit amounts leave the API as decimal strings so clients never round them through doubles.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer bigIntegerAsString() {
        return builder -> builder.serializerByType(BigInteger.class, ToStringSerializer.instance);
    }
}
