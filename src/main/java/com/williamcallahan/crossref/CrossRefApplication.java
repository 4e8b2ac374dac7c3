package com.williamcallahan.crossref;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CrossRefApplication {

    public static void main(String[] args) {
        // No web server; exit with the command line's status once the runners finish
        System.exit(SpringApplication.exit(SpringApplication.run(CrossRefApplication.class, args)));
    }

}
