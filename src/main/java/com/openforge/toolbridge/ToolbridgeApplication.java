package com.openforge.toolbridge;

import com.openforge.toolbridge.agent.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AgentProperties.class)
public class ToolbridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolbridgeApplication.class, args);
    }
}
