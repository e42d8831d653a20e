package com.example.sectionfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SectionFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SectionFinderApplication.class, args);
    }

}
