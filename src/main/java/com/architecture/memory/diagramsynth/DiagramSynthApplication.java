package com.architecture.memory.diagramsynth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiagramSynthApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiagramSynthApplication.class, args);
    }
}
