package com.registry.core.model;

/**
 * Kind of alias mutation recorded in the audit log.
 */
public enum AliasAction {
    CREATE,
    UPDATE
}
