package com.example.ajml.domain;

import java.util.Objects;

/**
 * Environment variable declared by the project; {@code defaultValue} is {@code null} when absent.
 */
public record EnvVar(String name, boolean required, String defaultValue) {
    public EnvVar {
        Objects.requireNonNull(name, "name");
    }
}
