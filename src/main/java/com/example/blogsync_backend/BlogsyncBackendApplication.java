package com.example.blogsync_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlogsyncBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(BlogsyncBackendApplication.class, args);
	}

}
