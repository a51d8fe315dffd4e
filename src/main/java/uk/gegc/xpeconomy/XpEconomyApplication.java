package uk.gegc.xpeconomy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class XpEconomyApplication {

    public static void main(String[] args) {
        SpringApplication.run(XpEconomyApplication.class, args);
    }
}
