/**
 * Layout tree: node model, persisted documents and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.splitdock.layouttree.tree} – {@link com.splitdock.layouttree.tree.PanelNode} (leaf) and
 *       {@link com.splitdock.layouttree.tree.SplitNode} (binary container), clamp bounds, directions</li>
 *   <li>{@link com.splitdock.layouttree.document} – {@link com.splitdock.layouttree.document.LayoutDocument}
 *       and {@link com.splitdock.layouttree.document.NodeDocument} (the persisted JSON shape)</li>
 *   <li>{@link com.splitdock.layouttree.load} – layout file read/write and default path resolution</li>
 *   <li>{@link com.splitdock.layouttree.validation} – on-demand structural validation</li>
 *   <li>{@link com.splitdock.layouttree.LayoutTreeConfig} – {@code fromJson}/{@code toJson}/{@code toJsonPretty};
 *       {@link com.splitdock.layouttree.LayoutCodec} – tree ⇄ document (strict reading, version {@code 2.0})</li>
 * </ul>
 */
package com.splitdock.layouttree;
