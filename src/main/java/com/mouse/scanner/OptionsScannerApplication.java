package com.mouse.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OptionsScannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(OptionsScannerApplication.class, args);
	}

}
