package io.github.drompincen.clawrelay.gateway;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawrelay")
@EnableMongoRepositories(basePackages = "io.github.drompincen.clawrelay.persistence.repository")
@EnableConfigurationProperties(RelayProperties.class)
@EnableScheduling
public class ClawRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawRelayApplication.class, args);
    }
}
