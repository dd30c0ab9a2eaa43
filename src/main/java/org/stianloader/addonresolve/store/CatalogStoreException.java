package org.stianloader.addonresolve.store;

/**
 * Thrown by a {@link CatalogStore} if it is unavailable or a query against it failed.
 */
public class CatalogStoreException extends Exception {

    private static final long serialVersionUID = 2194771930572381174L;

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
