package com.cargo.monitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ExceptionHandlerClientConfig {

    @Bean
    public RestClient exceptionHandlerRestClient(RestClient.Builder builder, MonitorConfig config) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) config.getDispatch().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) config.getDispatch().getReadTimeout().toMillis());

        return builder
                .baseUrl(config.getDispatch().getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
