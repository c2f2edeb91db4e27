package com.example.partstream.error;

import java.util.List;

/**
 * Invalid setup detected while the application context starts. Never raised per request.
 */
public class ConfigurationException extends PartstreamException {

    public static final String CODE = "configuration_error";

    private final List<String> problems;

    public ConfigurationException(String problem) {
        this(List.of(problem));
    }

    public ConfigurationException(List<String> problems) {
        super(CODE, "[partstream] invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
