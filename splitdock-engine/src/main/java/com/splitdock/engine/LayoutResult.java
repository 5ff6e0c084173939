package com.splitdock.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a docking manager operation: success with the ordered change notifications it produced,
 * or failure with an error kind and message (and no changes).
 */
public final class LayoutResult {

    private final boolean success;
    private final LayoutError error;
    private final String message;
    private final List<LayoutChange> changes;

    private LayoutResult(boolean success, LayoutError error, String message, List<LayoutChange> changes) {
        this.success = success;
        this.error = error;
        this.message = message;
        this.changes = changes != null ? Collections.unmodifiableList(new ArrayList<>(changes)) : List.of();
    }

    public static LayoutResult success(List<LayoutChange> changes) {
        return new LayoutResult(true, null, null, changes);
    }

    public static LayoutResult success() {
        return new LayoutResult(true, null, null, List.of());
    }

    public static LayoutResult failure(LayoutError error, String message) {
        return new LayoutResult(false, Objects.requireNonNull(error, "error"), message, List.of());
    }

    public boolean isSuccess() {
        return success;
    }

    /** Null on success. */
    public LayoutError getError() {
        return error;
    }

    /** Human-readable failure reason; null on success. */
    public String getMessage() {
        return message;
    }

    /** Change notifications in emission order; empty on failure. */
    public List<LayoutChange> getChanges() {
        return changes;
    }

    @Override
    public String toString() {
        return success ? "LayoutResult{success, changes=" + changes + "}" : "LayoutResult{" + error + ": " + message + "}";
    }
}
