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
package net.boyechko.boxtree.build;

/**
 * Where an {@link InlineBlockSplitter} search resumes: the index of the child to resume at and,
 * when the previous block was found inside that child, the cursor within it. A null {@code
 * nested} means resume at {@code index} from that child's start.
 */
public record SplitCursor(int index, SplitCursor nested) {

    public SplitCursor {
        if (index < 0) {
            throw new IllegalArgumentException("Cursor index must not be negative: " + index);
        }
    }

    public static SplitCursor at(int index) {
        return new SplitCursor(index, null);
    }

    /** Nesting depth: 1 for a cursor without a nested one. */
    public int depth() {
        return nested == null ? 1 : 1 + nested.depth();
    }
}
