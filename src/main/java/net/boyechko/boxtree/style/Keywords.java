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

import java.util.Locale;
import java.util.function.Function;

final class Keywords {
    private Keywords() {}

    static <E extends Enum<E>> E parse(
            Class<E> type, String property, String keyword, Function<E, String> keywordOf) {
        String normalized = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        for (E value : type.getEnumConstants()) {
            if (keywordOf.apply(value).equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported " + property + ": " + keyword);
    }
}
