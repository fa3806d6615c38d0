package com.example.slidecast_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlidecastBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlidecastBackendApplication.class, args);
    }

}
