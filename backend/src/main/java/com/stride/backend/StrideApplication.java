package com.stride.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StrideApplication {
	public static void main(String[] args) {
		SpringApplication.run(StrideApplication.class, args);
	}
}
