package com.recaprio.projection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProjectionSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProjectionSyncApplication.class, args);
    }
}
