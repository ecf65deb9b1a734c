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

import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;

/**
 * Hook for elements whose boxes are not built from their content, such as replaced elements.
 * Called for every element whose display is not {@code none}, before its box is built.
 */
@FunctionalInterface
public interface ElementHandler {

    HandlerResult handle(DocumentContext ctx, Element element);

    /** Handles nothing; every element gets default construction. */
    static ElementHandler none() {
        return (ctx, element) -> HandlerResult.defaultHandling();
    }
}
