package com.github.mirrorfetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MirrorFetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(MirrorFetchApplication.class, args);
    }
}
