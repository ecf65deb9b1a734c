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
package net.boyechko.boxtree.image;

import java.net.URI;
import java.util.Optional;

/** Loads images referenced by styles, such as {@code list-style-image}. */
@FunctionalInterface
public interface ImageResolver {

    /** Returns the loaded image, or empty if it is unavailable or unreadable. */
    Optional<ImageSurface> resolve(URI uri);

    static ImageResolver none() {
        return uri -> Optional.empty();
    }
}
