package com.mangaku.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MangakuScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(MangakuScraperApplication.class, args);
    }
}
