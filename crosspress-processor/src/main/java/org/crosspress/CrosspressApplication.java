package org.crosspress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrosspressApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CrosspressApplication.class, args)));
    }
}
