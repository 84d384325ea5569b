package com.notegraph.core.service.search;

/**
 * Path predicate for search scopes.
 */
public final class ScopeFilter {

    private ScopeFilter() {
    }

    /**
     * IN_FILE keeps only the current file; IN_FOLDER keeps the folder itself and paths below it
     * (everything when no folder is set); VAULT keeps everything.
     */
    public static boolean keep(ScopeMode mode, SearchScope scope, String path) {
        return switch (mode) {
            case IN_FILE -> scope.currentFilePath() != null && scope.currentFilePath().equals(path);
            case IN_FOLDER -> isInFolder(scope.folderPath(), path);
            case VAULT -> true;
        };
    }

    private static boolean isInFolder(String folderPath, String path) {
        if (folderPath == null || folderPath.isEmpty()) {
            return true;
        }
        return path.equals(folderPath) || path.startsWith(folderPath + "/");
    }
}
