package com.linlay.agentroom.config;

import com.linlay.agentroom.context.CharRatioTokenEstimator;
import com.linlay.agentroom.context.TokenEstimator;
import com.linlay.agentroom.ratelimit.Sleeper;
import com.linlay.agentroom.security.PathValidator;
import com.linlay.agentroom.tool.ListFilesTool;
import com.linlay.agentroom.tool.ReadFileTool;
import com.linlay.agentroom.tool.SearchTool;
import com.linlay.agentroom.tool.ShellTool;
import com.linlay.agentroom.tool.ToolRegistry;
import com.linlay.agentroom.tool.WriteFileTool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestrationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public TokenEstimator tokenEstimator() {
        return new CharRatioTokenEstimator();
    }

    @Bean
    public ToolRegistry toolRegistry(PathValidator pathValidator, ToolProperties toolProperties) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ShellTool(pathValidator, toolProperties.getShell()));
        registry.register(new ReadFileTool(pathValidator));
        registry.register(new WriteFileTool(pathValidator));
        registry.register(new ListFilesTool(pathValidator));
        registry.register(new SearchTool(pathValidator));
        return registry;
    }
}
