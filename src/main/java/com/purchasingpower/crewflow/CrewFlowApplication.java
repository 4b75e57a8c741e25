package com.purchasingpower.crewflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CrewFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrewFlowApplication.class, args);
    }
}
