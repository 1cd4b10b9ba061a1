package com.livebundle.core.model;

/**
 * Kind of filesystem change reported by a workspace watcher.
 */
public enum ChangeKind {
    CREATE,
    MODIFY,
    DELETE
}
