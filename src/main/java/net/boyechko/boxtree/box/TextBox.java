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

/** An anonymous inline box holding a run of text. */
public final class TextBox extends Box {
    private String text;

    public TextBox(DocumentContext document, Element element, ComputedStyle style, String text) {
        super(document, element, style);
        this.text = text != null ? text : "";
    }

    /** Text owned by {@code element}, styled as an anonymous inline box inside it. */
    public static TextBox forText(DocumentContext document, Element element, String text) {
        return new TextBox(
                document, element, ComputedStyle.inheritedFrom(document.styleFor(element)), text);
    }

    /** Text inside the given box, inheriting its style. */
    public static TextBox inside(Box owner, String text) {
        return new TextBox(
                owner.document(),
                owner.element(),
                ComputedStyle.inheritedFrom(owner.style()),
                text);
    }

    @Override
    public BoxKind kind() {
        return BoxKind.TEXT;
    }

    public String text() {
        return text;
    }

    /** Replaces the text in place; used by white-space processing. */
    public void setText(String text) {
        this.text = text != null ? text : "";
    }

    @Override
    public TextBox copy() {
        return new TextBox(document(), element(), style(), text);
    }
}
