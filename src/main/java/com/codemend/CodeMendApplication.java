package com.codemend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeMendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeMendApplication.class, args);
    }
}
