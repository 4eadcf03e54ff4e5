package com.nei10u.bazi;

import com.nei10u.bazi.config.BaziEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BaziEngineProperties.class)
public class BaziEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaziEngineApplication.class, args);
    }
}
