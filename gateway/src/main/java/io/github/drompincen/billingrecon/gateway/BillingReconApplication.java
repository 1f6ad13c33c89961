package io.github.drompincen.billingrecon.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.billingrecon")
@EnableMongoRepositories(basePackages = "io.github.drompincen.billingrecon.persistence.repository")
@EnableScheduling
public class BillingReconApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingReconApplication.class, args);
    }
}
