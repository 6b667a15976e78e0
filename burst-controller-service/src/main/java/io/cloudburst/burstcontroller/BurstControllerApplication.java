package io.cloudburst.burstcontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.cloudburst.burstcontroller.config")
public class BurstControllerApplication {
    public static void main(String[] args) {
        SpringApplication.run(BurstControllerApplication.class, args);
    }
}
