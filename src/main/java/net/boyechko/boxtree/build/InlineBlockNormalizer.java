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

import java.util.List;
import net.boyechko.boxtree.box.AnonymousBlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.LineBox;
import net.boyechko.boxtree.box.ParentBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups the inline-level content of block containers into line boxes. Consecutive inline-level
 * children become one {@link LineBox}; next to block-level siblings that line box is wrapped in an
 * {@link AnonymousBlockBox}. A container with only inline-level content gets a single bare line
 * box.
 *
 * <pre>
 * BlockBox                         BlockBox
 *   TextBox "Some "                  AnonymousBlockBox
 *   InlineBox            becomes       LineBox
 *   BlockBox                             TextBox "Some "
 *     TextBox "More"                     InlineBox
 *                                    BlockBox
 *                                      LineBox
 *                                        TextBox "More"
 * </pre>
 *
 * <p>The tree is rewritten in place.
 */
public class InlineBlockNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(InlineBlockNormalizer.class);

    private int wrappedLines;

    /** Normalizes {@code box} and everything below it; returns the same box. */
    public Box normalize(Box box) {
        wrappedLines = 0;
        normalizeSubtree(box);
        logger.debug("Wrapped {} line box(es) in anonymous blocks", wrappedLines);
        return box;
    }

    private void normalizeSubtree(Box box) {
        if (!(box instanceof ParentBox parent)) {
            return;
        }
        for (Box child : parent.children()) {
            normalizeSubtree(child);
        }
        if (parent.isBlockContainer()) {
            rebuildChildren(parent);
        }
    }

    private void rebuildChildren(ParentBox container) {
        List<Box> children = container.removeAllChildren();
        LineBox line = LineBox.inside(container);

        for (Box child : children) {
            if (child.isBlockLevel()) {
                if (line.hasChildren()) {
                    container.addChild(wrap(container, line));
                    line = LineBox.inside(container);
                }
                container.addChild(child);
            } else if (child instanceof LineBox nested) {
                line.addChildren(nested.children());
            } else {
                line.addChild(child);
            }
        }

        if (line.hasChildren()) {
            if (container.hasChildren()) {
                container.addChild(wrap(container, line));
            } else {
                container.addChild(line);
            }
        }
    }

    private AnonymousBlockBox wrap(ParentBox container, LineBox line) {
        wrappedLines++;
        return AnonymousBlockBox.wrapping(container, line);
    }
}
