package eu.virtualparadox.hybridqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HybridQaApplication {

    public static void main(final String[] args) {
        SpringApplication.run(HybridQaApplication.class, args);
    }
}
