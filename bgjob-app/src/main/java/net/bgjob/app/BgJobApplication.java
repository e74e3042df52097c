package net.bgjob.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BgJobApplication {

    public static void main(String[] args) {
        SpringApplication.run(BgJobApplication.class, args);
    }
}
