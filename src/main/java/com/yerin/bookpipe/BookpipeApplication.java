package com.yerin.bookpipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BookpipeApplication {

	public static void main(String[] args) {
		SpringApplication.run(BookpipeApplication.class, args);
	}

}
