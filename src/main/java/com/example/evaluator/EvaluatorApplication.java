package com.example.evaluator;

import com.example.evaluator.config.EvaluationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EvaluationProperties.class)
public class EvaluatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(EvaluatorApplication.class, args);
	}

}
