package com.bbthechange.eventapi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class EventApiApplication {

	private static final Logger logger = LoggerFactory.getLogger(EventApiApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(EventApiApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Event API listening on port {}", event.getWebServer().getPort());
	}

}
