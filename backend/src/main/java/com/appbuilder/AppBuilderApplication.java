package com.appbuilder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AppBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AppBuilderApplication.class, args);
    }
}
