package com.example.imagestore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImageStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageStoreApplication.class, args);
    }
}
