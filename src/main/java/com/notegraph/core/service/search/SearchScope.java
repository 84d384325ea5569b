package com.notegraph.core.service.search;

/**
 * Scope parameters. {@code currentFilePath} also anchors the graph boost.
 */
public record SearchScope(String currentFilePath, String folderPath) {

    public static SearchScope none() {
        return new SearchScope(null, null);
    }

    public static SearchScope inFile(String currentFilePath) {
        return new SearchScope(currentFilePath, null);
    }

    public static SearchScope inFolder(String folderPath) {
        return new SearchScope(null, folderPath);
    }
}
