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

import java.util.HashMap;
import java.util.Map;
import net.boyechko.boxtree.document.Element;

/**
 * Computes styles from a {@link UserAgentStylesheet} and {@code style} attributes. Inherited
 * properties come from the parent element; the tag's stylesheet declarations apply next, then
 * the element's own {@code style} attribute.
 */
public class StylesheetStyleProvider implements StyleProvider {
    private static final String STYLE_ATTRIBUTE = "style";

    private final UserAgentStylesheet stylesheet;
    private final Map<Element, ComputedStyle> computed = new HashMap<>();

    public StylesheetStyleProvider(UserAgentStylesheet stylesheet) {
        this.stylesheet = stylesheet;
    }

    public static StylesheetStyleProvider withDefaultStylesheet() {
        return new StylesheetStyleProvider(UserAgentStylesheet.loadDefault());
    }

    @Override
    public ComputedStyle styleFor(Element element) {
        ComputedStyle cached = computed.get(element);
        if (cached != null) {
            return cached;
        }

        ComputedStyle parentStyle = element.parent() != null ? styleFor(element.parent()) : null;
        ComputedStyle style =
                parentStyle != null
                        ? ComputedStyle.inheritedFrom(parentStyle)
                        : ComputedStyle.INITIAL;

        style = Declarations.apply(style, parentStyle, stylesheet.declarationsFor(element.name()));

        String inline = element.attribute(STYLE_ATTRIBUTE);
        if (inline != null) {
            style = Declarations.apply(style, parentStyle, Declarations.parse(inline));
        }

        computed.put(element, style);
        return style;
    }
}
