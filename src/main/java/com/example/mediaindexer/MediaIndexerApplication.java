package com.example.mediaindexer;

import com.example.mediaindexer.common.config.AppImageProperties;
import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.config.AppWatchProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.mediaindexer.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppWatchProperties.class,
        AppScanProperties.class,
        AppImageProperties.class
})
public class MediaIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaIndexerApplication.class, args);
    }
}
