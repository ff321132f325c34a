package org.example.imagegen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImageGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageGenApplication.class, args);
    }
}
