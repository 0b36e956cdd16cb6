package com.copyleft.DrawGuess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class DrawGuessApplication {

	public static void main(String[] args) {
		SpringApplication.run(DrawGuessApplication.class, args);
	}

}
