package org.iceforge.olap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OlapEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlapEngineApplication.class, args);
    }
}
