package com.aiinpocket.loyalty;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LoyaltyProperties.class)
public class LoyaltyProgressionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoyaltyProgressionApplication.class, args);
    }

}
