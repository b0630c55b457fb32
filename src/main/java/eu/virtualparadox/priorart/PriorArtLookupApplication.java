package eu.virtualparadox.priorart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriorArtLookupApplication {

    public static void main(final String[] args) {
        SpringApplication.run(PriorArtLookupApplication.class, args);
    }
}
