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
 * A {@code display} value this library cannot build boxes for. Signals that the style provider
 * produced something outside the supported set, so construction stops.
 */
public class UnsupportedDisplayException extends IllegalArgumentException {
    private final String value;

    public UnsupportedDisplayException(String value) {
        super("Unsupported display: " + value);
        this.value = value;
    }

    /** The offending display value, as given. */
    public String value() {
        return value;
    }
}
