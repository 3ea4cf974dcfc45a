package ch.xavier.quantlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QuantLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantLabApplication.class, args);
    }
}
