package net.labsched.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LabschedApplication {
    public static void main(String[] args) {
        SpringApplication.run(LabschedApplication.class, args);
    }
}
