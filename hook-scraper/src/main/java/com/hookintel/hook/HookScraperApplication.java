package com.hookintel.hook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class HookScraperApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HookScraperApplication.class, args)));
    }
}
