package com.prakash.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchedulePlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SchedulePlannerApplication.class, args);
	}

}
