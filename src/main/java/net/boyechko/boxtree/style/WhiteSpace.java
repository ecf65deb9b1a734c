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

/** Values of the {@code white-space} property. */
public enum WhiteSpace {
    NORMAL("normal", true, true),
    NOWRAP("nowrap", true, true),
    PRE("pre", false, false),
    PRE_WRAP("pre-wrap", false, false),
    PRE_LINE("pre-line", true, false);

    private final String keyword;
    private final boolean collapsesSpaces;
    private final boolean collapsesNewlines;

    WhiteSpace(String keyword, boolean collapsesSpaces, boolean collapsesNewlines) {
        this.keyword = keyword;
        this.collapsesSpaces = collapsesSpaces;
        this.collapsesNewlines = collapsesNewlines;
    }

    public String keyword() {
        return keyword;
    }

    /** True for modes where runs of spaces and tabs collapse to one space. */
    public boolean collapsesSpaces() {
        return collapsesSpaces;
    }

    /** True for modes where newlines become spaces. */
    public boolean collapsesNewlines() {
        return collapsesNewlines;
    }

    public static WhiteSpace fromKeyword(String keyword) {
        return Keywords.parse(WhiteSpace.class, "white-space", keyword, WhiteSpace::keyword);
    }
}
