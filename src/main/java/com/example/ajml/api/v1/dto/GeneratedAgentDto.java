package com.example.ajml.api.v1.dto;

import com.example.ajml.codegen.GeneratedAgent;

/**
 * One generated Python module.
 */
public record GeneratedAgentDto(String agentName, String moduleName, String fileName, String source) {

    public static GeneratedAgentDto from(GeneratedAgent generated) {
        return new GeneratedAgentDto(generated.agentName(), generated.moduleName(), generated.fileName(),
                generated.source());
    }
}
