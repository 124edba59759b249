package com.hometwin.ingestion.config;

import com.hometwin.common.model.DeviceClassTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Twin store connection and device class table.
 */
@Slf4j
@Configuration
public class TwinStoreConfig {

    @Value("${app.twin-store.base-url}")
    private String baseUrl;

    @Value("${app.twin-store.bearer-token:}")
    private String bearerToken;

    @Bean
    public WebClient twinStoreWebClient(WebClient.Builder builder) {
        WebClient.Builder configured = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(bearerToken)) {
            configured.defaultHeaders(headers -> headers.setBearerAuth(bearerToken));
        }
        return configured.build();
    }

    @Bean
    public DeviceClassTable deviceClassTable() {
        DeviceClassTable table = DeviceClassTable.defaults();
        log.info("Ingesting device classes {}", table);
        return table;
    }
}
