package com.tokenx.scheduler;

import java.util.Optional;

/**
 * Somewhere the import scan can pick up otpauth text, such as the system clipboard.
 */
public interface ImportSource {

    /**
     * Current text of the source, or empty if there is none or it cannot be read right now.
     */
    Optional<String> poll();

    String getName();
}
