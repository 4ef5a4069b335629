package com.example.ajml.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Set;

/**
 * Settings under {@code ajml.compiler}.
 *
 * @param supportedVersions accepted {@code ajml_version} values of project documents
 * @param samplesLocation   classpath folder holding one sub-folder per bundled sample project
 * @param corsOrigins       origins allowed to call {@code /api/**}
 */
@ConfigurationProperties("ajml.compiler")
public record CompilerProperties(
        @DefaultValue("2.0") Set<String> supportedVersions,
        @DefaultValue("samples") String samplesLocation,
        @DefaultValue("http://localhost:5173") List<String> corsOrigins
) {
}
