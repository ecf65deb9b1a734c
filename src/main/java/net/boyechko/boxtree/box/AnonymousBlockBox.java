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

/** Block-level box generated around inline content that sits next to block-level siblings. */
public final class AnonymousBlockBox extends ParentBox {

    public AnonymousBlockBox(DocumentContext document, Element element, ComputedStyle style) {
        super(document, element, style);
    }

    /** A new anonymous block for content of {@code container}, inheriting its style. */
    public static AnonymousBlockBox inside(Box container) {
        return new AnonymousBlockBox(
                container.document(),
                container.element(),
                ComputedStyle.inheritedFrom(container.style()));
    }

    /** Wraps a single child in a new anonymous block inside {@code container}. */
    public static AnonymousBlockBox wrapping(Box container, Box child) {
        AnonymousBlockBox anon = inside(container);
        anon.addChild(child);
        return anon;
    }

    @Override
    public BoxKind kind() {
        return BoxKind.ANONYMOUS_BLOCK;
    }

    @Override
    public AnonymousBlockBox copyEmpty() {
        return new AnonymousBlockBox(document(), element(), style());
    }
}
