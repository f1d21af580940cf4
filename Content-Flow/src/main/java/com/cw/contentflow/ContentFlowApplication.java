package com.cw.contentflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContentFlowApplication {
    public static void main(String[] args) {
        SpringApplication.run(ContentFlowApplication.class, args);
    }
}
