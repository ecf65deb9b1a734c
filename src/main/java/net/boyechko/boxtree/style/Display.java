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
import net.boyechko.boxtree.build.UnsupportedDisplayException;

/** Computed values of the CSS 2.1 {@code display} property. */
public enum Display {
    INLINE("inline"),
    BLOCK("block"),
    LIST_ITEM("list-item"),
    INLINE_BLOCK("inline-block"),
    RUN_IN("run-in"),
    TABLE("table"),
    INLINE_TABLE("inline-table"),
    TABLE_ROW_GROUP("table-row-group"),
    TABLE_HEADER_GROUP("table-header-group"),
    TABLE_FOOTER_GROUP("table-footer-group"),
    TABLE_ROW("table-row"),
    TABLE_COLUMN_GROUP("table-column-group"),
    TABLE_COLUMN("table-column"),
    TABLE_CELL("table-cell"),
    TABLE_CAPTION("table-caption"),
    NONE("none");

    private final String keyword;

    Display(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Parses a {@code display} keyword.
     *
     * @throws UnsupportedDisplayException if the keyword is not a CSS 2.1 display value
     */
    public static Display fromKeyword(String keyword) {
        String normalized = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        for (Display d : values()) {
            if (d.keyword.equals(normalized)) {
                return d;
            }
        }
        throw new UnsupportedDisplayException(keyword);
    }
}
