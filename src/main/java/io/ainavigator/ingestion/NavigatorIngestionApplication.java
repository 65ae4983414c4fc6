package io.ainavigator.ingestion;

import io.ainavigator.ingestion.config.NewsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
@EnableConfigurationProperties(NewsConfig.class)
@ConfigurationPropertiesScan
public class NavigatorIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(NavigatorIngestionApplication.class, args);
    }
}
