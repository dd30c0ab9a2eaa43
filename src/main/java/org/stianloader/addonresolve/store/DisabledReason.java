package org.stianloader.addonresolve.store;

/**
 * The reason an installed add-on was disabled for.
 */
public enum DisabledReason {
    NONE,
    USER,

    /**
     * The add-on was disabled because it is not compatible with the running application,
     * for example after the application was upgraded to a new API version.
     */
    INCOMPATIBLE,
    PERMANENT_FAILURE;
}
