/*
 * CSS-BoxTree - Formatting structure construction for CSS 2.1 layout
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.boxtree.validation;

import java.util.List;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.document.DocumentContext;

/**
 * Immutable context passed to visitors during box tree traversal.
 *
 * @param parent the box this one is a child of; for an outside marker, the box owning it; null
 *     for the root
 * @param path slash-and-dot path such as {@code /BlockBox<body>[1].LineBox[2]}, for diagnostics
 */
public record VisitorContext(
        Box box,
        Box parent,
        String path,
        /** Depth in the tree (0 = root). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex,
        /** True when the box is an outside list marker rather than a child. */
        boolean outsideMarker,
        DocumentContext docCtx) {

    public boolean isRoot() {
        return parent == null;
    }

    public List<Box> children() {
        return BoxTree.childrenOf(box);
    }
}
