package com.cecil.assembler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RasterAssemblerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RasterAssemblerApplication.class, args);
    }
}
