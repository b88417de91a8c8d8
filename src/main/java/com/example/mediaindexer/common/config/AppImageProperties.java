package com.example.mediaindexer.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.image")
public class AppImageProperties {

    private String baseUrl = "https://image.tmdb.org/t/p/";

    private String cacheDir = "./data/images";

    private String defaultVariant = "original";

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 15000;
}
