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
import java.util.List;

/** Utilities for traversing and printing box trees. */
public final class BoxTree {

    private BoxTree() {}

    /** The box and all its descendants in document order, outside markers excluded. */
    public static List<Box> descendants(Box root) {
        return descendants(root, false);
    }

    /**
     * The box and all its descendants in document order. With {@code includeOutsideMarkers}, a
     * block's outside marker comes right after the block and before its children.
     */
    public static List<Box> descendants(Box root, boolean includeOutsideMarkers) {
        List<Box> out = new ArrayList<>();
        collect(root, includeOutsideMarkers, out);
        return out;
    }

    private static void collect(Box box, boolean includeOutsideMarkers, List<Box> out) {
        out.add(box);
        if (includeOutsideMarkers
                && box instanceof BlockBox block
                && block.hasOutsideListMarker()) {
            collect(block.outsideListMarker(), true, out);
        }
        if (box instanceof ParentBox parent) {
            for (Box child : parent.children()) {
                collect(child, includeOutsideMarkers, out);
            }
        }
    }

    /** Children of a box, or an empty list for leaves. */
    public static List<Box> childrenOf(Box box) {
        return box instanceof ParentBox parent ? parent.children() : List.of();
    }

    /**
     * Returns an indented dump of the tree, one box per line, two spaces per level. Outside markers
     * are shown as {@code ::marker} lines before the children of their box.
     */
    public static String toIndentedTreeString(Box root) {
        StringBuilder sb = new StringBuilder();
        appendIndentedTree(sb, root, 0);
        return sb.toString();
    }

    private static void appendIndentedTree(StringBuilder sb, Box box, int depth) {
        sb.append("  ".repeat(depth));
        sb.append(label(box));
        sb.append('\n');

        if (box instanceof BlockBox block && block.hasOutsideListMarker()) {
            sb.append("  ".repeat(depth + 1));
            sb.append("::marker ");
            sb.append(label(block.outsideListMarker()));
            sb.append('\n');
        }
        for (Box child : childrenOf(box)) {
            appendIndentedTree(sb, child, depth + 1);
        }
    }

    /** One-line description: the variant, then the element or the text. */
    public static String label(Box box) {
        String variant = box.getClass().getSimpleName();
        if (box instanceof TextBox text) {
            return variant + " \"" + escape(text.text()) + "\"";
        }
        if (box instanceof ImageMarkerBox marker) {
            return variant + " " + marker.image().source();
        }
        if (box.isAnonymous() || box.element() == null) {
            return variant;
        }
        return variant + " <" + box.element().name() + ">";
    }

    /** Escapes characters that are invisible or ambiguous in a dump. */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\u00A0' -> sb.append("\\u00A0");
                case '\u200B' -> sb.append("\\u200B");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
