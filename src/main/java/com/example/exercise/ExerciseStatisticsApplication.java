package com.example.exercise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ExerciseStatisticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExerciseStatisticsApplication.class, args);
	}

}
