package com.lox.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoxPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoxPlaygroundApplication.class, args);
    }
}
