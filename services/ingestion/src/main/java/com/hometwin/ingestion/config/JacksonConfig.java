package com.hometwin.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hometwin.common.util.JsonUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Uses the shared event ObjectMapper for the REST endpoints, so replayed events are read
 * exactly as the stream's payloads are.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    // A replay batch of 1000 state objects with attributes exceeds the 256KB codec default
    @Value("${app.http.max-request-size:4MB}")
    private DataSize maxRequestSize;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = JsonUtil.getObjectMapper();
        configurer.defaultCodecs().maxInMemorySize((int) maxRequestSize.toBytes());
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
    }
}
