package com.splitdock.engine;

/**
 * Receives change notifications from a {@link DockingManager}, e.g. the rendering layer.
 * Called synchronously after the tree has been fully restructured; the listener may call back into the manager.
 * Exceptions thrown by a listener are logged and do not affect the mutation or other listeners.
 */
@FunctionalInterface
public interface LayoutChangeListener {

    void onLayoutChange(LayoutChange change);
}
