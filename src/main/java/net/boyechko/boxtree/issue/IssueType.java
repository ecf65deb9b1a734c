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
package net.boyechko.boxtree.issue;

/** Kinds of structural problems a box tree check can report. */
public enum IssueType {
    // Line box placement
    LINE_BOX_OUTSIDE_BLOCK_CONTAINER("line boxes outside block containers"),
    LINE_BOX_WITH_SIBLINGS("line boxes with siblings"),
    NON_INLINE_IN_LINE_BOX("non-inline boxes directly inside line boxes"),

    // Block-in-inline splitting
    BLOCK_IN_LINE("block-level boxes inside line boxes"),

    // Anonymous boxes and markers
    ANONYMOUS_BOX_STYLE("anonymous boxes with their own style"),
    OUTSIDE_MARKER_IN_FLOW("outside list markers in normal flow");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
