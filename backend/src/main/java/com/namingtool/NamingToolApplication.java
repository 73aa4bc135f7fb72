package com.namingtool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Naming Tool - compiles resource naming schemas into governance policies.
 */
@SpringBootApplication
public class NamingToolApplication {

	public static void main(String[] args) {
		SpringApplication.run(NamingToolApplication.class, args);
	}

}
