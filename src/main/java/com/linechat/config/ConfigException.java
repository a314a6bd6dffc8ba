package com.linechat.config;

/**
 * The configuration file exists but cannot be read or parsed.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
