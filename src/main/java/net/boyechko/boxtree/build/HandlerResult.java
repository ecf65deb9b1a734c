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

import net.boyechko.boxtree.box.Box;

/** What an {@link ElementHandler} decided for an element. */
public sealed interface HandlerResult {

    /** Build the element's box the normal way. */
    record Default() implements HandlerResult {}

    /** Use this box for the element; its content is not visited. */
    record Replaced(Box box) implements HandlerResult {
        public Replaced {
            if (box == null) {
                throw new IllegalArgumentException("Replacement box is required");
            }
        }
    }

    /** The element produces no box at all. */
    record Suppressed() implements HandlerResult {}

    static HandlerResult defaultHandling() {
        return new Default();
    }

    static HandlerResult replaceWith(Box box) {
        return new Replaced(box);
    }

    static HandlerResult suppress() {
        return new Suppressed();
    }
}
