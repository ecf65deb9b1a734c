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
 * Box for {@code display: inline-block}: inline-level on the outside, a block container on the
 * inside.
 */
public final class InlineBlockBox extends ParentBox {

    public InlineBlockBox(DocumentContext document, Element element, ComputedStyle style) {
        super(document, element, style);
    }

    public static InlineBlockBox forElement(DocumentContext document, Element element) {
        return new InlineBlockBox(document, element, document.styleFor(element));
    }

    @Override
    public BoxKind kind() {
        return BoxKind.INLINE_BLOCK;
    }

    @Override
    public InlineBlockBox copyEmpty() {
        return new InlineBlockBox(document(), element(), style());
    }
}
