package com.schoolhub.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class SchoolhubApplication {

	public static void main(String[] args) {
		SpringApplication.run(SchoolhubApplication.class, args);
	}

}

/*
Must stay in the root package so component scanning reaches every module below it.
 */
