package com.koni.vitals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VitalsPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VitalsPipelineApplication.class, args);
    }
}
