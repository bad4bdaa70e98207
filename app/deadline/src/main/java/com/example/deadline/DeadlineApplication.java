/*
 * Where: Deadline service entry point
 * What: Boots Spring and scans the typed configuration records
 * Why: The job scheduler and its collaborators are wired from one context
 */
package com.example.deadline;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DeadlineApplication {

	public static void main(String[] args) {
		SpringApplication.run(DeadlineApplication.class, args);
	}
}
