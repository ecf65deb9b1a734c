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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.style.ComputedStyle;

/** A box with an ordered list of children, in document order. */
public abstract sealed class ParentBox extends Box
        permits InlineBox, InlineBlockBox, BlockBox, AnonymousBlockBox, LineBox {

    private final List<Box> children = new ArrayList<>();

    protected ParentBox(DocumentContext document, Element element, ComputedStyle style) {
        super(document, element, style);
    }

    /** A new box of the same kind, element and style, with no children. */
    public abstract ParentBox copyEmpty();

    public ParentBox copyWithChildren(List<? extends Box> newChildren) {
        ParentBox copy = copyEmpty();
        copy.addChildren(newChildren);
        return copy;
    }

    @Override
    public ParentBox copy() {
        return copyWithChildren(children);
    }

    public List<Box> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public ParentBox addChild(Box child) {
        if (child == null) {
            throw new IllegalArgumentException("Cannot add a null child to " + this);
        }
        children.add(child);
        return this;
    }

    public ParentBox addChildren(List<? extends Box> newChildren) {
        for (Box child : newChildren) {
            addChild(child);
        }
        return this;
    }

    /** Removes and returns all children, leaving this box empty. */
    public List<Box> removeAllChildren() {
        List<Box> old = new ArrayList<>(children);
        children.clear();
        return old;
    }
}
