package com.tony.baseballStats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BaseballStatsApplication {

	public static void main(String[] args) {
		SpringApplication.run(BaseballStatsApplication.class, args);
	}

}
