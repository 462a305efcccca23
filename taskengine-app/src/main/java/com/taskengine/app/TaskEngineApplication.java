package com.taskengine.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the task engine.
 */
@SpringBootApplication
public class TaskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskEngineApplication.class, args);
    }
}
