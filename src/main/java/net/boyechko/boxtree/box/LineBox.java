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

/**
 * Groups consecutive inline-level content of a block container. Later broken into actual lines
 * by layout.
 */
public final class LineBox extends ParentBox {

    public LineBox(DocumentContext document, Element element, ComputedStyle style) {
        super(document, element, style);
    }

    /** A new, empty line box for content of {@code container}. */
    public static LineBox inside(Box container) {
        return new LineBox(
                container.document(),
                container.element(),
                ComputedStyle.inheritedFrom(container.style()));
    }

    @Override
    public BoxKind kind() {
        return BoxKind.LINE;
    }

    @Override
    public LineBox copyEmpty() {
        return new LineBox(document(), element(), style());
    }
}
