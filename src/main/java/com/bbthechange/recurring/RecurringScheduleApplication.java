package com.bbthechange.recurring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class RecurringScheduleApplication {

	private static final Logger logger = LoggerFactory.getLogger(RecurringScheduleApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(RecurringScheduleApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Recurring schedule engine listening on port {}", event.getWebServer().getPort());
	}

}
