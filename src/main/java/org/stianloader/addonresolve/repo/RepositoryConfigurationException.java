package org.stianloader.addonresolve.repo;

/**
 * Thrown if the list of official repositories cannot be read or contains malformed entries.
 */
public class RepositoryConfigurationException extends RuntimeException {

    private static final long serialVersionUID = -4460924416153460351L;

    public RepositoryConfigurationException(String message) {
        super(message);
    }

    public RepositoryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
