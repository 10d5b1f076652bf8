package com.printdesk.jobcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobCoreApplication.class, args);
    }
}
