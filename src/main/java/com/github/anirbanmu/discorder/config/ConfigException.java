package com.github.anirbanmu.discorder.config;

public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
