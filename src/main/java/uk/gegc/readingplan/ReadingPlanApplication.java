package uk.gegc.readingplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadingPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadingPlanApplication.class, args);
    }
}
