package com.example.rls;

import com.example.rls.config.properties.RlsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(RlsProperties.class)
public class RlsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RlsEngineApplication.class, args);
    }

}
