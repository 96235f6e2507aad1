package com.cvjudge.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CvJudgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvJudgeApplication.class, args);
    }
}
