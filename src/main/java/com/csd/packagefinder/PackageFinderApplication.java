package com.csd.packagefinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PackageFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PackageFinderApplication.class, args);
    }
}
