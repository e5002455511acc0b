package io.github.yok.statlink.config;

import io.github.yok.statlink.StatLinkException;

/**
 * Raised when backend or job configuration is missing or invalid.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends StatLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
