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
package net.boyechko.boxtree.document;

/**
 * A node of the source document tree. Elements carry content; comments and processing
 * instructions only matter for the text that follows them ({@link #tail()}).
 */
public abstract sealed class Node permits Element, Comment, ProcessingInstruction {
    private String tail = "";
    private Element parent;

    /** Text immediately following this node inside its parent, never null. */
    public String tail() {
        return tail;
    }

    public void setTail(String tail) {
        this.tail = tail != null ? tail : "";
    }

    /** The element containing this node, or null for the root. */
    public Element parent() {
        return parent;
    }

    void setParent(Element parent) {
        this.parent = parent;
    }
}
