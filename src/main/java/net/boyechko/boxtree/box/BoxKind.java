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

/**
 * Discriminant of the box variants. Every category question the pipeline asks about a box is
 * answered here, from the kind alone.
 */
public enum BoxKind {
    TEXT(Flags.INLINE_LEVEL),
    IMAGE_MARKER(Flags.INLINE_LEVEL),
    INLINE(Flags.INLINE_LEVEL | Flags.PARENT),
    INLINE_BLOCK(Flags.INLINE_LEVEL | Flags.PARENT | Flags.BLOCK_CONTAINER),
    BLOCK(Flags.BLOCK_LEVEL | Flags.PARENT | Flags.BLOCK_CONTAINER),
    ANONYMOUS_BLOCK(Flags.BLOCK_LEVEL | Flags.PARENT | Flags.BLOCK_CONTAINER | Flags.ANONYMOUS),
    LINE(Flags.PARENT | Flags.ANONYMOUS);

    private final int flags;

    BoxKind(int flags) {
        this.flags = flags;
    }

    /** Stacks vertically in a block formatting context. */
    public boolean isBlockLevel() {
        return (flags & Flags.BLOCK_LEVEL) != 0;
    }

    /** Participates in an inline formatting context. */
    public boolean isInlineLevel() {
        return (flags & Flags.INLINE_LEVEL) != 0;
    }

    /** May hold either block-level boxes or line boxes as children. */
    public boolean isBlockContainer() {
        return (flags & Flags.BLOCK_CONTAINER) != 0;
    }

    public boolean isParent() {
        return (flags & Flags.PARENT) != 0;
    }

    /** Generated to satisfy structural rules; has no style of its own. */
    public boolean isAnonymous() {
        return (flags & Flags.ANONYMOUS) != 0;
    }

    private static final class Flags {
        static final int BLOCK_LEVEL = 1;
        static final int INLINE_LEVEL = 1 << 1;
        static final int BLOCK_CONTAINER = 1 << 2;
        static final int PARENT = 1 << 3;
        static final int ANONYMOUS = 1 << 4;
    }
}
