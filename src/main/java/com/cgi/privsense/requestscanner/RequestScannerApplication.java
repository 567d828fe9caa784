package com.cgi.privsense.requestscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RequestScannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RequestScannerApplication.class, args);
	}

}
