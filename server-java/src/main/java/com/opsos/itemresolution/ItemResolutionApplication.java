package com.opsos.itemresolution;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
@EntityScan(basePackages = "com.opsos.itemresolution.model")
public class ItemResolutionApplication {

    public static void main(String[] args) {
        // A batch command runs without the web server and exits when done.
        boolean batch = false;
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                batch = true;
                break;
            }
        }
        new SpringApplicationBuilder(ItemResolutionApplication.class)
                .web(batch ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);
    }
}
