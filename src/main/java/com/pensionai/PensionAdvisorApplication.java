package com.pensionai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PensionAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PensionAdvisorApplication.class, args);
    }
}
