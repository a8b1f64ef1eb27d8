package io.uvlanalyzer.standalone.config;

/**
 * Thrown when the server configuration cannot be loaded: missing file, invalid YAML, an
 * unparseable environment override or an out-of-range value.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
