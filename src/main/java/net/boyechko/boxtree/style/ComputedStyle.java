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
package net.boyechko.boxtree.style;

/**
 * The computed values box construction needs.
 *
 * @param listStyleImage the image reference from {@code list-style-image}, or null for {@code
 *     none}
 */
public record ComputedStyle(
        Display display,
        WhiteSpace whiteSpace,
        String listStyleImage,
        ListStyleType listStyleType,
        ListStylePosition listStylePosition) {

    /** Initial values of every property, as for the root element with no declarations. */
    public static final ComputedStyle INITIAL =
            new ComputedStyle(
                    Display.INLINE,
                    WhiteSpace.NORMAL,
                    null,
                    ListStyleType.DISC,
                    ListStylePosition.OUTSIDE);

    public ComputedStyle {
        if (display == null
                || whiteSpace == null
                || listStyleType == null
                || listStylePosition == null) {
            throw new IllegalArgumentException("Only list-style-image may be null");
        }
    }

    /**
     * Style of an anonymous box (or text) inside a box with the given style: inherited properties
     * are copied, everything else takes its initial value.
     */
    public static ComputedStyle inheritedFrom(ComputedStyle parent) {
        return new ComputedStyle(
                INITIAL.display,
                parent.whiteSpace,
                parent.listStyleImage,
                parent.listStyleType,
                parent.listStylePosition);
    }

    public boolean hasListStyleImage() {
        return listStyleImage != null;
    }

    public ComputedStyle withDisplay(Display value) {
        return new ComputedStyle(
                value, whiteSpace, listStyleImage, listStyleType, listStylePosition);
    }

    public ComputedStyle withWhiteSpace(WhiteSpace value) {
        return new ComputedStyle(display, value, listStyleImage, listStyleType, listStylePosition);
    }

    public ComputedStyle withListStyleImage(String value) {
        return new ComputedStyle(display, whiteSpace, value, listStyleType, listStylePosition);
    }

    public ComputedStyle withListStyleType(ListStyleType value) {
        return new ComputedStyle(display, whiteSpace, listStyleImage, value, listStylePosition);
    }

    public ComputedStyle withListStylePosition(ListStylePosition value) {
        return new ComputedStyle(display, whiteSpace, listStyleImage, listStyleType, value);
    }
}
