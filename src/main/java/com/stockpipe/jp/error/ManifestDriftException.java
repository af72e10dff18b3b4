package com.stockpipe.jp.error;

import java.util.List;

/**
 * Objects exist under the mutable prefix that the manifest does not declare.
 */
public class ManifestDriftException extends Exception {
    private final List<String> orphanKeys;

    public ManifestDriftException(List<String> orphanKeys) {
        super("manifest drift: " + (orphanKeys == null ? 0 : orphanKeys.size()) + " undeclared object(s)");
        this.orphanKeys = orphanKeys == null ? List.of() : List.copyOf(orphanKeys);
    }

    public List<String> orphanKeys() {
        return orphanKeys;
    }
}
