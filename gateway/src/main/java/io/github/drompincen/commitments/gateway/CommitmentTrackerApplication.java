package io.github.drompincen.commitments.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.commitments")
@EnableMongoRepositories(basePackages = "io.github.drompincen.commitments.persistence.repository")
public class CommitmentTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommitmentTrackerApplication.class, args);
    }
}
