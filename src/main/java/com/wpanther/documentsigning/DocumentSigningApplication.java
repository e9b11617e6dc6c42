package com.wpanther.documentsigning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocumentSigningApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentSigningApplication.class, args);
    }
}
