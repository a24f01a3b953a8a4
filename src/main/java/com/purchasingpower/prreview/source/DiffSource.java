package com.purchasingpower.prreview.source;

import com.purchasingpower.prreview.exception.FetchException;

/**
 * Capability to retrieve diff text for a remote change reference.
 * Invoked at most once per review run.
 */
public interface DiffSource {

    /**
     * @param reference remote reference, e.g. a pull request URL
     * @param token     optional caller-supplied credential, overrides the configured one
     * @return metadata and assembled unified diff text
     * @throws FetchException if the diff cannot be retrieved or has no textual content
     */
    FetchedDiff fetch(String reference, String token);
}
