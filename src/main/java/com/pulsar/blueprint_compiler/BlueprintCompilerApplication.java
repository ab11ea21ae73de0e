package com.pulsar.blueprint_compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlueprintCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlueprintCompilerApplication.class, args);
    }
}
