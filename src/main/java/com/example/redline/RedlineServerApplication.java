package com.example.redline;

import com.example.redline.config.RedlineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(RedlineProperties.class)
public class RedlineServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedlineServerApplication.class, args);
    }

}
