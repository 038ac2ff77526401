package com.koni.vitals.infrastructure.client;

import com.koni.vitals.infrastructure.config.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * HTTP client for the upstream time series API.
 */
@Configuration
public class TimeseriesClientConfiguration {
    
    static final String AUTHORIZATION_HEADER = "authorization";
    
    /**
     * RestClient with connect and read timeouts and the bearer token header.
     * The upstream API only accepts the header name in lower case.
     */
    @Bean
    public RestClient timeseriesRestClient(RestClient.Builder builder, PipelineProperties properties) {
        PipelineProperties.Api api = properties.getApi();
        
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(api.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(api.getReadTimeout());
        
        return builder
                .baseUrl(api.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(AUTHORIZATION_HEADER, "Bearer " + api.getToken())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
