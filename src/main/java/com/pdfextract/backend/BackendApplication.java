package com.pdfextract.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import com.pdfextract.backend.config.DotenvLoader;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackendApplication {

	public static void main(String[] args) {
		DotenvLoader.loadFromWorkingDirectoryIfPresent();
		SpringApplication.run(BackendApplication.class, args);
	}

}
