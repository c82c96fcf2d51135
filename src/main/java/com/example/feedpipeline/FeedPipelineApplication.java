package com.example.feedpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FeedPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedPipelineApplication.class, args);
    }

}
