package com.softpower.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SoftPowerBackendApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(SoftPowerBackendApplication.class, args);
        // Batch commands exit with the report's status instead of serving requests
        if (context.containsBean("pipelineCommandRunner")) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
