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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses and applies {@code property: value} declaration blocks, such as style attributes. */
public final class Declarations {
    private static final Logger logger = LoggerFactory.getLogger(Declarations.class);

    private static final String INHERIT = "inherit";

    private Declarations() {}

    /**
     * Splits a declaration block into property/value pairs, in order. Property names are
     * lowercased; a repeated property keeps its last value and moves to the last position. Entries
     * without a colon are skipped.
     */
    public static Map<String, String> parse(String block) {
        Map<String, String> out = new LinkedHashMap<>();
        if (block == null) {
            return out;
        }
        for (String declaration : splitOutsideParens(block, ';')) {
            int colon = declaration.indexOf(':');
            if (colon < 0) {
                if (!declaration.isBlank()) {
                    logger.debug("Skipping malformed declaration '{}'", declaration.trim());
                }
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim();
            if (!property.isEmpty() && !value.isEmpty()) {
                out.remove(property);
                out.put(property, value);
            }
        }
        return out;
    }

    /**
     * Applies declarations on top of {@code base}. {@code parent} supplies values for {@code
     * inherit}; it may be null at the root, where {@code inherit} means the initial value.
     */
    public static ComputedStyle apply(
            ComputedStyle base, ComputedStyle parent, Map<String, String> declarations) {
        ComputedStyle inheritFrom = parent != null ? parent : ComputedStyle.INITIAL;
        ComputedStyle style = base;
        for (Map.Entry<String, String> decl : declarations.entrySet()) {
            String value = decl.getValue();
            boolean inherit = INHERIT.equalsIgnoreCase(value.trim());
            style =
                    switch (decl.getKey()) {
                        case "display" ->
                                style.withDisplay(
                                        inherit
                                                ? inheritFrom.display()
                                                : Display.fromKeyword(value));
                        case "white-space" ->
                                style.withWhiteSpace(
                                        inherit
                                                ? inheritFrom.whiteSpace()
                                                : WhiteSpace.fromKeyword(value));
                        case "list-style-type" ->
                                style.withListStyleType(
                                        inherit
                                                ? inheritFrom.listStyleType()
                                                : ListStyleType.fromKeyword(value));
                        case "list-style-position" ->
                                style.withListStylePosition(
                                        inherit
                                                ? inheritFrom.listStylePosition()
                                                : ListStylePosition.fromKeyword(value));
                        case "list-style-image" ->
                                style.withListStyleImage(
                                        inherit
                                                ? inheritFrom.listStyleImage()
                                                : parseImage(value));
                        case "list-style" ->
                                inherit
                                        ? style.withListStyleType(inheritFrom.listStyleType())
                                                .withListStylePosition(
                                                        inheritFrom.listStylePosition())
                                                .withListStyleImage(inheritFrom.listStyleImage())
                                        : applyListStyleShorthand(style, value);
                        default -> {
                            logger.debug("Ignoring unsupported property '{}'", decl.getKey());
                            yield style;
                        }
                    };
        }
        return style;
    }

    /** Parses {@code none} or {@code url(...)}, returning null for {@code none}. */
    static String parseImage(String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("none")) {
            return null;
        }
        if (v.regionMatches(true, 0, "url(", 0, 4) && v.endsWith(")")) {
            String inner = v.substring(4, v.length() - 1).trim();
            if (inner.length() >= 2
                    && (inner.startsWith("\"") && inner.endsWith("\"")
                            || inner.startsWith("'") && inner.endsWith("'"))) {
                inner = inner.substring(1, inner.length() - 1);
            }
            if (!inner.isEmpty()) {
                return inner;
            }
        }
        throw new IllegalArgumentException("Unsupported list-style-image: " + value);
    }

    /**
     * The {@code list-style} shorthand resets type, position and image, then sets the ones given.
     * A {@code none} token applies to whichever of type and image is not otherwise set.
     */
    private static ComputedStyle applyListStyleShorthand(ComputedStyle style, String value) {
        ListStyleType type = null;
        ListStylePosition position = null;
        String image = null;
        boolean imageSet = false;
        int nones = 0;

        for (String token : splitOutsideParens(value.trim(), ' ')) {
            String t = token.trim();
            if (t.isEmpty()) {
                continue;
            }
            if (t.equalsIgnoreCase("none")) {
                nones++;
            } else if (t.regionMatches(true, 0, "url(", 0, 4)) {
                image = parseImage(t);
                imageSet = true;
            } else if (t.equalsIgnoreCase("inside") || t.equalsIgnoreCase("outside")) {
                position = ListStylePosition.fromKeyword(t);
            } else {
                type = ListStyleType.fromKeyword(t);
            }
        }
        if (nones > 0 && type == null) {
            type = ListStyleType.NONE;
            nones--;
        }
        if (nones > 0 && imageSet) {
            throw new IllegalArgumentException("Unsupported list-style: " + value);
        }

        return style.withListStyleType(type != null ? type : ComputedStyle.INITIAL.listStyleType())
                .withListStylePosition(
                        position != null ? position : ComputedStyle.INITIAL.listStylePosition())
                .withListStyleImage(image);
    }

    private static List<String> splitOutsideParens(String s, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }
}
