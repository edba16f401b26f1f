package com.example.sourcesync;

import com.example.sourcesync.common.config.AppLoopDetectionProperties;
import com.example.sourcesync.common.config.AppSecurityProperties;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.config.AppWebDavProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.sourcesync.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSecurityProperties.class,
        AppWebDavProperties.class,
        AppSyncProperties.class,
        AppLoopDetectionProperties.class
})
public class SourceSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SourceSyncApplication.class, args);
    }
}
