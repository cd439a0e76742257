package com.mixtape.playlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MixtapePlaylistApplication {

    public static void main(String[] args) {
        SpringApplication.run(MixtapePlaylistApplication.class, args);
    }
}
