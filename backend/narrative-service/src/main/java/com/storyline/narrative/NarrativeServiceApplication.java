package com.storyline.narrative;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NarrativeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NarrativeServiceApplication.class, args);
    }
}
