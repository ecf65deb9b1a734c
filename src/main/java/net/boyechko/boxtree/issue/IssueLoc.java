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

import net.boyechko.boxtree.box.Box;

/** Where in the box tree an issue was found. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtBox(Box box, String path) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atBox(Box box, String path) {
        return new AtBox(box, path);
    }

    /** Tree path of the box, or null when there is no location. */
    default String path() {
        return this instanceof AtBox at ? at.path() : null;
    }
}
