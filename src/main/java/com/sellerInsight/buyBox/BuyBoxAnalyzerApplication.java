package com.sellerInsight.buyBox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BuyBoxAnalyzerApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(BuyBoxAnalyzerApplication.class, args);
    }
}
