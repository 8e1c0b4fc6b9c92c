package com.example.wager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@ConfigurationPropertiesScan
public class WageringEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(WageringEngineApplication.class, args);
	}

}
