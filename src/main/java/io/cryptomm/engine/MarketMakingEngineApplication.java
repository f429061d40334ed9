package io.cryptomm.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MarketMakingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketMakingEngineApplication.class, args);
    }

}
