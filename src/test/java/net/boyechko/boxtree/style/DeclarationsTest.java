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

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.boxtree.build.UnsupportedDisplayException;
import org.junit.jupiter.api.Test;

class DeclarationsTest {

    private static final ComputedStyle PARENT =
            ComputedStyle.INITIAL
                    .withDisplay(Display.BLOCK)
                    .withWhiteSpace(WhiteSpace.PRE)
                    .withListStyleType(ListStyleType.SQUARE);

    @Test
    void parsesDeclarationBlocks() {
        Map<String, String> decls =
                Declarations.parse(
                        " Display : block ; junk; white-space:pre-line;;display: inline");

        assertEquals(Map.of("display", "inline", "white-space", "pre-line"), decls);
    }

    @Test
    void semicolonsInsideUrlsDoNotSplit() {
        Map<String, String> decls =
                Declarations.parse("list-style-image: url(\"data:image/png;base64,AAA\")");

        assertEquals("url(\"data:image/png;base64,AAA\")", decls.get("list-style-image"));
    }

    @Test
    void nullBlockHasNoDeclarations() {
        assertTrue(Declarations.parse(null).isEmpty());
    }

    @Test
    void appliesLonghands() {
        ComputedStyle style =
                apply(
                        "display: list-item; white-space: pre-wrap; list-style-type: circle;"
                                + " list-style-position: inside; list-style-image: url(dot.png)");

        assertEquals(Display.LIST_ITEM, style.display());
        assertEquals(WhiteSpace.PRE_WRAP, style.whiteSpace());
        assertEquals(ListStyleType.CIRCLE, style.listStyleType());
        assertEquals(ListStylePosition.INSIDE, style.listStylePosition());
        assertEquals("dot.png", style.listStyleImage());
    }

    @Test
    void inheritTakesTheParentValue() {
        ComputedStyle style = apply("display: inherit; white-space: INHERIT");

        assertEquals(Display.BLOCK, style.display());
        assertEquals(WhiteSpace.PRE, style.whiteSpace());
    }

    @Test
    void listStyleShorthandResetsWhatItDoesNotSet() {
        ComputedStyle base =
                ComputedStyle.INITIAL
                        .withListStyleType(ListStyleType.SQUARE)
                        .withListStyleImage("old.png");

        ComputedStyle style =
                Declarations.apply(base, null, Declarations.parse("list-style: inside"));

        assertEquals(ListStyleType.DISC, style.listStyleType());
        assertEquals(ListStylePosition.INSIDE, style.listStylePosition());
        assertNull(style.listStyleImage());
    }

    @Test
    void listStyleNoneAppliesToTheType() {
        ComputedStyle style = apply("list-style: none url('star.png')");

        assertEquals(ListStyleType.NONE, style.listStyleType());
        assertEquals("star.png", style.listStyleImage());
    }

    @Test
    void listStyleNoneNoneClearsTypeAndImage() {
        ComputedStyle style = apply("list-style: none none");

        assertEquals(ListStyleType.NONE, style.listStyleType());
        assertNull(style.listStyleImage());
    }

    @Test
    void unknownPropertiesAreIgnored() {
        assertEquals(ComputedStyle.INITIAL, apply("color: red; margin: 0"));
    }

    @Test
    void unsupportedValuesAreRejected() {
        assertThrows(UnsupportedDisplayException.class, () -> apply("display: flex"));
        assertThrows(IllegalArgumentException.class, () -> apply("white-space: break-spaces"));
        assertThrows(IllegalArgumentException.class, () -> apply("list-style-type: decimal"));
        assertThrows(IllegalArgumentException.class, () -> apply("list-style-image: dot.png"));
    }

    @Test
    void aRepeatedShorthandOverridesEarlierLonghands() {
        Map<String, String> decls =
                Declarations.parse(
                        "list-style: none; list-style-type: square; list-style: inside");

        assertEquals(List.of("list-style-type", "list-style"), List.copyOf(decls.keySet()));
        ComputedStyle style = Declarations.apply(ComputedStyle.INITIAL, null, decls);
        assertEquals(ListStyleType.DISC, style.listStyleType());
        assertEquals(ListStylePosition.INSIDE, style.listStylePosition());
    }

    @Test
    void laterDeclarationsWin() {
        Map<String, String> decls = new LinkedHashMap<>();
        decls.put("list-style-type", "square");
        decls.put("list-style", "circle");

        ComputedStyle style = Declarations.apply(ComputedStyle.INITIAL, null, decls);

        assertEquals(ListStyleType.CIRCLE, style.listStyleType());
    }

    private static ComputedStyle apply(String block) {
        return Declarations.apply(ComputedStyle.INITIAL, PARENT, Declarations.parse(block));
    }
}
