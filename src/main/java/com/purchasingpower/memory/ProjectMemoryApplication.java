package com.purchasingpower.memory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ProjectMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProjectMemoryApplication.class, args);
    }
}
