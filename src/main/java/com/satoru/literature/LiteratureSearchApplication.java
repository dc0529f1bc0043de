package com.satoru.literature;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
@ConfigurationPropertiesScan
public class LiteratureSearchApplication {

	public static void main(String[] args) {
		SpringApplication.run(LiteratureSearchApplication.class, args);
	}
}
