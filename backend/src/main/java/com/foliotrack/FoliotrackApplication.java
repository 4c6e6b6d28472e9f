package com.foliotrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoliotrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoliotrackApplication.class, args);
    }
}
