package com.color.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ColorXApplication {

	public static void main(String[] args) {
		SpringApplication.run(ColorXApplication.class, args);
	}

}
