package com.example.homemic_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class HomemicBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(HomemicBackendApplication.class, args);
	}

}
