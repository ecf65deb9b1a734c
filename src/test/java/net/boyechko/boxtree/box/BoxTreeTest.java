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

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.util.List;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.image.ImageSurface;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.style.Display;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoxTreeTest {

    record StubImage(URI source) implements ImageSurface {
        @Override
        public float width() {
            return 8;
        }

        @Override
        public float height() {
            return 8;
        }
    }

    private DocumentContext ctx;
    private Element li;
    private BlockBox item;

    @BeforeEach
    void setUp() {
        li = Element.of("li");
        Element.of("ul").appendChild(li);
        ctx =
                DocumentContext.of(
                        li,
                        element ->
                                element.name().equals("li")
                                        ? ComputedStyle.INITIAL.withDisplay(Display.LIST_ITEM)
                                        : ComputedStyle.INITIAL);
        item = BlockBox.forElement(ctx, li);
    }

    @Test
    void dumpShowsVariantsElementsAndText() {
        LineBox line = LineBox.inside(item);
        line.addChild(TextBox.forText(ctx, li, "one\ttwo \"three\"\n"));
        item.addChild(AnonymousBlockBox.wrapping(item, line));

        assertEquals(
                String.join(
                        "\n",
                        "BlockBox <li>",
                        "  AnonymousBlockBox",
                        "    LineBox",
                        "      TextBox \"one\\ttwo \\\"three\\\"\\n\"",
                        ""),
                BoxTree.toIndentedTreeString(item));
    }

    @Test
    void outsideMarkersAreShownBeforeChildren() {
        ImageMarkerBox marker =
                new ImageMarkerBox(
                        ctx,
                        li,
                        ComputedStyle.INITIAL,
                        new StubImage(URI.create("file:///dot.png")));
        marker.inheritStyleFrom(item);
        item.setOutsideListMarker(marker);
        item.addChild(TextBox.inside(item, "x"));

        assertEquals(
                String.join(
                        "\n",
                        "BlockBox <li>",
                        "  ::marker ImageMarkerBox file:///dot.png",
                        "  TextBox \"x\"",
                        ""),
                BoxTree.toIndentedTreeString(item));
    }

    @Test
    void escapesInvisibleSpaces() {
        assertEquals("a\\u00A0\\u200Bb\\\\", BoxTree.escape("a\u00A0\u200Bb\\"));
    }

    @Test
    void descendantsAreInDocumentOrder() {
        TextBox marker = TextBox.inside(item, "\u2022");
        item.setOutsideListMarker(marker);
        InlineBox em = InlineBox.forElement(ctx, li);
        TextBox a = TextBox.inside(em, "a");
        em.addChild(a);
        TextBox b = TextBox.inside(item, "b");
        item.addChildren(List.of(em, b));

        assertEquals(List.of(item, em, a, b), BoxTree.descendants(item));
        assertEquals(List.of(item, marker, em, a, b), BoxTree.descendants(item, true));
        assertEquals(List.of(), BoxTree.childrenOf(a));
    }

    @Test
    void copiesShareChildrenButNotTheList() {
        TextBox a = TextBox.inside(item, "a");
        item.addChild(a);

        ParentBox copy = item.copy();
        copy.addChild(TextBox.inside(item, "b"));

        assertNotSame(item, copy);
        assertSame(a, copy.children().get(0));
        assertEquals(1, item.children().size());
        assertEquals(item.style(), copy.style());
    }

    @Test
    void removingChildrenEmptiesTheBox() {
        TextBox a = TextBox.inside(item, "a");
        item.addChild(a);

        assertEquals(List.of(a), item.removeAllChildren());
        assertFalse(item.hasChildren());
        assertThrows(IllegalArgumentException.class, () -> item.addChild(null));
    }

    @Test
    void styleParentReDerivesTheInheritedStyle() {
        TextBox marker = TextBox.inside(item, "\u2022");
        InlineBox em = InlineBox.forElement(ctx, li);

        marker.inheritStyleFrom(em);

        assertSame(em, marker.styleParent());
        assertEquals(ComputedStyle.inheritedFrom(em.style()), marker.style());
        assertNull(em.styleParent());
    }
}
