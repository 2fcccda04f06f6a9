package io.logscope.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LogscopeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogscopeEngineApplication.class, args);
    }
}
