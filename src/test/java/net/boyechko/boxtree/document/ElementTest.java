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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ElementTest {

    @Test
    void appendingSetsTheParent() {
        Element em = Element.of("em").setText("x").withTail(" y");
        Element p = Element.of("p").append(em, new Comment("c"));

        assertSame(p, em.parent());
        assertEquals(2, p.children().size());
        assertEquals(1, p.elementChildren().size());
        assertEquals(" y", em.tail());
    }

    @Test
    void aNodeBelongsToOneParent() {
        Element em = Element.of("em");
        Element.of("p").appendChild(em);

        assertThrows(IllegalArgumentException.class, () -> Element.of("div").appendChild(em));
    }

    @Test
    void textAndTailAreNeverNull() {
        Element p = Element.of("p").setText(null).withTail(null);

        assertEquals("", p.text());
        assertEquals("", p.tail());
    }

    @Test
    void childrenCannotBeModifiedDirectly() {
        Element p = Element.of("p");

        assertThrows(
                UnsupportedOperationException.class, () -> p.children().add(Element.of("em")));
    }
}
