package org.smileyface.siteaudit.crawler;

/**
 * Thrown before any fetch when the crawl configuration cannot be used.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
