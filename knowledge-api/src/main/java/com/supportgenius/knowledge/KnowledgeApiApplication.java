package com.supportgenius.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeApiApplication.class, args);
    }
}
