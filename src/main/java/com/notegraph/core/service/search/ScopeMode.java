package com.notegraph.core.service.search;

/**
 * Which part of the vault results may come from.
 */
public enum ScopeMode {
    VAULT,
    IN_FILE,
    IN_FOLDER
}
