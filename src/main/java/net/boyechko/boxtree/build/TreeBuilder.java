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

import java.util.Optional;
import net.boyechko.boxtree.box.BlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.InlineBlockBox;
import net.boyechko.boxtree.box.InlineBox;
import net.boyechko.boxtree.box.ParentBox;
import net.boyechko.boxtree.box.TextBox;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.document.Node;
import net.boyechko.boxtree.style.Display;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the initial box tree from the element tree: one box per displayed element, with text
 * and tails as anonymous {@link TextBox}es. Anonymous block and line boxes are added later.
 *
 * <p>For {@code <p>Some <em>emphasised</em> text.</p>} this gives
 *
 * <pre>
 * BlockBox &lt;p&gt;
 *   TextBox "Some "
 *   InlineBox &lt;em&gt;
 *     TextBox "emphasised"
 *   TextBox " text."
 * </pre>
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final DocumentContext ctx;
    private final ListMarkerInserter markerInserter;

    public TreeBuilder(DocumentContext ctx) {
        this(ctx, new ListMarkerInserter());
    }

    public TreeBuilder(DocumentContext ctx, ListMarkerInserter markerInserter) {
        this.ctx = ctx;
        this.markerInserter = markerInserter;
    }

    /**
     * Builds the box for {@code element} and its subtree.
     *
     * @return empty when the element has {@code display: none} or the element handler suppressed
     *     it
     * @throws UnsupportedDisplayException for display values other than block, list-item, inline
     *     and inline-block
     */
    public Optional<Box> build(Element element) {
        Display display = ctx.styleFor(element).display();
        if (display == Display.NONE) {
            logger.trace("Pruned {} (display: none)", element);
            return Optional.empty();
        }

        HandlerResult handled = ctx.elementHandler().handle(ctx, element);
        if (handled instanceof HandlerResult.Replaced replaced) {
            return Optional.of(replaced.box());
        }
        if (handled instanceof HandlerResult.Suppressed) {
            logger.trace("Element handler suppressed {}", element);
            return Optional.empty();
        }

        ParentBox box = createBox(element, display);

        if (!element.text().isEmpty()) {
            box.addChild(TextBox.forText(ctx, element, element.text()));
        }
        for (Node child : element.children()) {
            if (child instanceof Element childElement) {
                build(childElement).ifPresent(box::addChild);
            }
            // Comments and processing instructions produce no box; their tails still count.
            if (!child.tail().isEmpty()) {
                box.addChild(TextBox.forText(ctx, element, child.tail()));
            }
        }
        return Optional.of(box);
    }

    private ParentBox createBox(Element element, Display display) {
        return switch (display) {
            case BLOCK -> BlockBox.forElement(ctx, element);
            case LIST_ITEM -> {
                BlockBox block = BlockBox.forElement(ctx, element);
                markerInserter.addListMarker(block);
                yield block;
            }
            case INLINE -> InlineBox.forElement(ctx, element);
            case INLINE_BLOCK -> InlineBlockBox.forElement(ctx, element);
            default -> throw new UnsupportedDisplayException(display.keyword());
        };
    }
}
