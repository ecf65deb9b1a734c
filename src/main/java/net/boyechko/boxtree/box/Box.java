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
 * A node of the formatting structure. The document and element are back references for style
 * lookup and diagnostics; they are never used to navigate the box tree.
 */
public abstract sealed class Box permits TextBox, ImageMarkerBox, ParentBox {
    private final DocumentContext document;
    private final Element element;
    private ComputedStyle style;
    private Box styleParent;

    protected Box(DocumentContext document, Element element, ComputedStyle style) {
        if (style == null) {
            throw new IllegalArgumentException("Boxes need a computed style");
        }
        this.document = document;
        this.element = element;
        this.style = style;
    }

    public abstract BoxKind kind();

    /** Shallow copy: same element and style; parent boxes share child references. */
    public abstract Box copy();

    public DocumentContext document() {
        return document;
    }

    public Element element() {
        return element;
    }

    public ComputedStyle style() {
        return style;
    }

    public boolean isBlockLevel() {
        return kind().isBlockLevel();
    }

    public boolean isInlineLevel() {
        return kind().isInlineLevel();
    }

    public boolean isBlockContainer() {
        return kind().isBlockContainer();
    }

    public boolean isParent() {
        return kind().isParent();
    }

    public boolean isAnonymous() {
        return kind().isAnonymous();
    }

    /**
     * The box this one inherits style from without being its child, such as the block owning an
     * outside list marker. Null for ordinary boxes.
     */
    public Box styleParent() {
        return styleParent;
    }

    /** Makes {@code owner} this box's style parent and re-derives the inherited style. */
    public void inheritStyleFrom(Box owner) {
        this.styleParent = owner;
        this.style = ComputedStyle.inheritedFrom(owner.style());
    }

    @Override
    public String toString() {
        return BoxTree.label(this);
    }
}
