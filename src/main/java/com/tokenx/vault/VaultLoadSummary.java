package com.tokenx.vault;

import com.tokenx.models.Credential;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class VaultLoadSummary {
    private final Map<String, Credential> loaded;
    private final List<String> failed;

    public VaultLoadSummary(Map<String, Credential> loaded, List<String> failed) {
        this.loaded = Collections.unmodifiableMap(loaded);
        this.failed = Collections.unmodifiableList(failed);
    }

    /**
     * Credentials keyed by vault name, in name order.
     */
    public Map<String, Credential> getLoaded() {
        return loaded;
    }

    /**
     * Names of files that could not be read, decrypted or parsed.
     */
    public List<String> getFailed() {
        return failed;
    }

    public int getLoadedCount() {
        return loaded.size();
    }

    public int getFailedCount() {
        return failed.size();
    }
}
