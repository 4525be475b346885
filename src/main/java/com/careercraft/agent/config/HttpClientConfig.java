package com.careercraft.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Pooled Apache HttpClient behind the model provider's RestClient.
 *
 * Connect plus socket timeout, times the retry attempts, fits inside
 * {@code agent.timeouts.model-invoke} so a retried call can still finish
 * before the engine's time limiter gives up on it.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout:3s}")
    private Duration connectTimeout;

    @Value("${llm.http.socket-timeout:10s}")
    private Duration socketTimeout;

    @Value("${llm.http.max-connections:20}")
    private int maxConnections;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(connectTimeout))
                                        .setSocketTimeout(Timeout.of(socketTimeout))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(socketTimeout))
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}s, socketTimeout={}s]",
                maxConnections, connectTimeout.toSeconds(), socketTimeout.toSeconds());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
