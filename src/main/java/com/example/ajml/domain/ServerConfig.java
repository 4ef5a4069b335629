package com.example.ajml.domain;

import java.util.Objects;

/**
 * Server policy of the generated service.
 *
 * @param authEnv name of the environment variable holding the API key; empty when auth is off
 */
public record ServerConfig(String corsOrigins, String authEnv, boolean docsPublic, String host, int port) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8000;

    public ServerConfig {
        Objects.requireNonNull(corsOrigins, "corsOrigins");
        Objects.requireNonNull(authEnv, "authEnv");
        Objects.requireNonNull(host, "host");
    }

    public static ServerConfig defaults() {
        return new ServerConfig("*", "", true, DEFAULT_HOST, DEFAULT_PORT);
    }
}
