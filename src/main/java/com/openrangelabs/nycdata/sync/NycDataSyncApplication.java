package com.openrangelabs.nycdata.sync;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(NycDataProperties.class)
public class NycDataSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(NycDataSyncApplication.class, args);
    }

}
