package com.example.mediaindexer.common.config;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ImageClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient imageHttpClient(AppImageProperties appImageProperties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appImageProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(appImageProperties.getConnectTimeoutMs())
                .setSocketTimeout(appImageProperties.getSocketTimeoutMs())
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setMaxConnTotal(16)
                .setMaxConnPerRoute(8)
                .setUserAgent("media-indexer")
                .build();
    }
}
