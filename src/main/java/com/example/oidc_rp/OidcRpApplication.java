package com.example.oidc_rp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OidcRpApplication {

	public static void main(String[] args) {
		SpringApplication.run(OidcRpApplication.class, args);
	}

}
