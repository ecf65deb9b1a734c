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
package net.boyechko.boxtree.box;

import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.style.ComputedStyle;

/** Box for {@code display: block} and {@code display: list-item}. */
public final class BlockBox extends ParentBox {
    private Box outsideListMarker;

    public BlockBox(DocumentContext document, Element element, ComputedStyle style) {
        super(document, element, style);
    }

    public static BlockBox forElement(DocumentContext document, Element element) {
        return new BlockBox(document, element, document.styleFor(element));
    }

    @Override
    public BoxKind kind() {
        return BoxKind.BLOCK;
    }

    /**
     * The list marker positioned outside this box, or null. It is not one of {@link #children()}
     * and only shows up in traversals that ask for markers.
     */
    public Box outsideListMarker() {
        return outsideListMarker;
    }

    public boolean hasOutsideListMarker() {
        return outsideListMarker != null;
    }

    public void setOutsideListMarker(Box marker) {
        this.outsideListMarker = marker;
    }

    /** Copies get their own copy of the outside marker, owned by the new box. */
    @Override
    public BlockBox copyEmpty() {
        BlockBox copy = new BlockBox(document(), element(), style());
        if (outsideListMarker != null) {
            Box marker = outsideListMarker.copy();
            marker.inheritStyleFrom(copy);
            copy.outsideListMarker = marker;
        }
        return copy;
    }
}
