/**
 * Docking engine: the single owner and mutator of a layout tree.
 *
 * <ul>
 *   <li>{@link com.splitdock.engine.DockingManager} – insert beside a target, remove with sibling promotion,
 *       split ratio updates, save/load (document and file), validation and debug dumps</li>
 *   <li>{@link com.splitdock.engine.PanelRegistry} – panel id → panel lookup kept in step with the tree</li>
 *   <li>{@link com.splitdock.engine.LayoutResult}, {@link com.splitdock.engine.LayoutError} – operation outcome</li>
 *   <li>{@link com.splitdock.engine.LayoutChange}, {@link com.splitdock.engine.LayoutChangeListener} – change
 *       notifications, delivered after each mutation has completed</li>
 * </ul>
 */
package com.splitdock.engine;
