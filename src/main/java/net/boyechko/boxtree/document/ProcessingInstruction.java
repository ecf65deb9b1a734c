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
package net.boyechko.boxtree.document;

/** An XML processing instruction. Skipped during box construction. */
public final class ProcessingInstruction extends Node {
    private final String target;
    private final String data;

    public ProcessingInstruction(String target, String data) {
        this.target = target;
        this.data = data != null ? data : "";
    }

    public String target() {
        return target;
    }

    public String data() {
        return data;
    }

    @Override
    public String toString() {
        return "<?" + target + " " + data + "?>";
    }
}
