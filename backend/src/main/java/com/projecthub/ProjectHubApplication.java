package com.projecthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProjectHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProjectHubApplication.class, args);
    }
}
