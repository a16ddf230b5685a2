package com.panorama;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanoramaApplication {
    public static void main(String[] args) {
        SpringApplication.run(PanoramaApplication.class, args);
    }
}
