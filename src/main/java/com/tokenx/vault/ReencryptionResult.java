package com.tokenx.vault;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a vault-wide password rotation. When {@code failed} is non-empty nothing was written
 * and {@code succeeded} lists the files that would have been rewritten.
 */
public class ReencryptionResult {
    private final List<String> succeeded;
    private final List<String> failed;
    private final boolean committed;

    public ReencryptionResult(List<String> succeeded, List<String> failed, boolean committed) {
        this.succeeded = Collections.unmodifiableList(succeeded);
        this.failed = Collections.unmodifiableList(failed);
        this.committed = committed;
    }

    public List<String> getSucceeded() {
        return succeeded;
    }

    public List<String> getFailed() {
        return failed;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public String toString() {
        return "ReencryptionResult{succeeded=" + succeeded.size()
            + ", failed=" + failed.size()
            + ", committed=" + committed + '}';
    }
}
