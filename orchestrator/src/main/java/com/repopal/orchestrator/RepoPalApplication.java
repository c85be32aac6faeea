package com.repopal.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RepoPalApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoPalApplication.class, args);
    }
}
