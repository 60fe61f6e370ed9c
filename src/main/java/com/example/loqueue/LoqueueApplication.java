package com.example.loqueue;

import com.example.loqueue.config.QueueProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(QueueProperties.class)
public class LoqueueApplication {

	public static void main(String[] args) {
		SpringApplication.run(LoqueueApplication.class, args);
	}

}
