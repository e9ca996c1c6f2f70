package com.certextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CertExtract - tiered extraction of compliance certificate data.
 */
@SpringBootApplication
public class CertExtractApplication {

	public static void main(String[] args) {
		SpringApplication.run(CertExtractApplication.class, args);
	}

}
