package com.example.ajml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AjmlCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AjmlCompilerApplication.class, args);
    }
}
