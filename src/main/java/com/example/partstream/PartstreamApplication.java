package com.example.partstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PartstreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartstreamApplication.class, args);
    }
}
