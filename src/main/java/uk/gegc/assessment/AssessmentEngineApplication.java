package uk.gegc.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssessmentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssessmentEngineApplication.class, args);
    }

}
