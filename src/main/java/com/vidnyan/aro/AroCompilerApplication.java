package com.vidnyan.aro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ARO compiler front end.
 * Compiles a source file and logs the report when {@code aro.check.path} is set.
 */
@SpringBootApplication
public class AroCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AroCompilerApplication.class, args);
    }
}
