package com.linlay.agentroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentRoomApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRoomApplication.class, args);
    }
}
