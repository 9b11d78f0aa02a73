package com.newsrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NewsRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsRelayApplication.class, args);
    }
}
