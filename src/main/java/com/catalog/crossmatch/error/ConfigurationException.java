package com.catalog.crossmatch.error;

/**
 * Thrown when a run parameter is invalid for the supplied catalogues.
 */
public class ConfigurationException extends CrossMatchException {

    private final String parameter;

    public ConfigurationException(String parameter, String message) {
        super(ErrorKind.CONFIGURATION, "[parameter=" + parameter + "] " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
