package io.zipstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ZipStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZipStreamApplication.class, args);
    }
}
