package com.cdnarchiver.common.errors;

/**
 * Missing or invalid configuration: route table, credentials, settings.
 */
public class ConfigurationException extends ArchiveException {

    public ConfigurationException(String message) {
        super(ArchiveErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ArchiveErrorKind.CONFIGURATION, message, cause);
    }
}
