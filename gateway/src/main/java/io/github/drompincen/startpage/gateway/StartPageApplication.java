package io.github.drompincen.startpage.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.startpage")
@EnableMongoRepositories(basePackages = "io.github.drompincen.startpage.persistence.repository")
public class StartPageApplication {

    public static void main(String[] args) {
        SpringApplication.run(StartPageApplication.class, args);
    }
}
