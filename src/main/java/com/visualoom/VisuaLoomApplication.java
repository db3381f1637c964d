package com.visualoom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.File;

@SpringBootApplication
public class VisuaLoomApplication {

    private static final Logger log = LoggerFactory.getLogger(VisuaLoomApplication.class);

    public static void main(String[] args) {
        // The catalog and tag files live here; create it before the repositories load
        ensureDataDirectory();
        SpringApplication.run(VisuaLoomApplication.class, args);
        log.info("VisuaLoom catalog service started");
    }

    private static void ensureDataDirectory() {
        File dir = new File("./data");
        if (!dir.exists()) {
            dir.mkdirs();
        }
    }
}
