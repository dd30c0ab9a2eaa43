package org.stianloader.addonresolve.repo;

/**
 * How thoroughly {@link OfficialRepositories#isOfficial(String, String, OriginCheck)} verifies that an
 * add-on comes from an official repository.
 */
public enum OriginCheck {

    /**
     * Only the repository id of the add-on is compared against the official repositories.
     * Suitable for answering "was this installed from an official repository?" in general terms.
     */
    LENIENT_REPO_ID_ONLY,

    /**
     * In addition to the repository id, the path of the add-on needs to start with the origin prefix
     * of the official repository. This prevents a third-party repository from passing itself off as an
     * official one by merely reusing its id. Used whenever trust decisions are derived from the result.
     */
    STRICT_WITH_PATH_PREFIX;
}
