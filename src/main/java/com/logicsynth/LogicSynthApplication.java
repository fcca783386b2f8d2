package com.logicsynth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogicSynthApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogicSynthApplication.class, args);
    }
}
