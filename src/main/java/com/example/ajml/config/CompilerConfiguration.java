package com.example.ajml.config;

import com.example.ajml.codegen.AgentCodeGenerator;
import com.example.ajml.compiler.ProjectCompiler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public AgentCodeGenerator agentCodeGenerator() {
        return new AgentCodeGenerator();
    }

    @Bean
    public ProjectCompiler projectCompiler(CompilerProperties properties, AgentCodeGenerator agentCodeGenerator) {
        return new ProjectCompiler(properties.supportedVersions(), agentCodeGenerator);
    }
}
