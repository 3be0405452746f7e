package com.yerin.bookpipe.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SourceClientConfig {

    @Bean(name = "sourceRestClient")
    public RestClient sourceRestClient(RestClient.Builder builder, BookpipeProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getGateway().getFetchTimeout());
        requestFactory.setReadTimeout(properties.getGateway().getFetchTimeout());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, "bookpipe/1.0")
                .build();
    }
}
