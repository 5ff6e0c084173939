package com.splitdock.engine;

/** Why a docking manager operation failed. A failed operation never changes the tree. */
public enum LayoutError {
    /** Id does not resolve to a node (insert target, remove target, split ratio target). */
    NOT_FOUND,
    /** Id already used by a node in the tree. */
    DUPLICATE,
    /** Malformed argument or document shape (blank id, missing direction, unknown node type, bad JSON). */
    INVALID_ARGUMENT,
    /** Persisted layout version is not the supported one. */
    VERSION_MISMATCH,
    /** Layout file missing, unreadable or not writable. */
    IO_FAILURE,
    /** Removal of the same panel is already running further up the call stack. */
    IN_PROGRESS,
    /** Close requested for a panel whose closable flag is off. */
    NOT_CLOSABLE
}
