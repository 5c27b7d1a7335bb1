package com.example.docredact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocRedactApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocRedactApplication.class, args);
    }
}
