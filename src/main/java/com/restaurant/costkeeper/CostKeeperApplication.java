package com.restaurant.costkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(CostKeeperApplication.class, args);
	}

}
