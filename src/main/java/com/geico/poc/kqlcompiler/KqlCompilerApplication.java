package com.geico.poc.kqlcompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KqlCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KqlCompilerApplication.class, args);
    }
}
