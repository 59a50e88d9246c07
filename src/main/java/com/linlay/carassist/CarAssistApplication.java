package com.linlay.carassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CarAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarAssistApplication.class, args);
    }
}
