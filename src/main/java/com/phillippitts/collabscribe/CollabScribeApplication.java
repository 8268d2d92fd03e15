package com.phillippitts.collabscribe;

import com.phillippitts.collabscribe.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(TranscriptionProperties.class)
@EnableScheduling
public class CollabScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabScribeApplication.class, args);
    }

}
