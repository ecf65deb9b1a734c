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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.boxtree.box.AnonymousBlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.InlineBox;
import net.boyechko.boxtree.box.LineBox;
import net.boyechko.boxtree.box.ParentBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves block-level boxes out of line boxes. Inline boxes that contain block-level boxes are
 * broken on each side of every such block, and the pieces of the line go into anonymous blocks:
 *
 * <pre>
 * BlockBox                             BlockBox
 *   LineBox                              AnonymousBlockBox
 *     InlineBox                            LineBox
 *       TextBox "Some "                      InlineBox
 *       BlockBox          becomes              TextBox "Some "
 *       TextBox " more"                  BlockBox
 *                                        AnonymousBlockBox
 *                                          LineBox
 *                                            InlineBox
 *                                              TextBox " more"
 * </pre>
 *
 * <p>Input boxes are never modified. A subtree with nothing to split is returned as the same
 * instance; changed subtrees are rebuilt from copies. Inline-block boxes are block containers of
 * their own and are split independently, never searched as part of the surrounding line.
 */
public class InlineBlockSplitter {
    private static final Logger logger = LoggerFactory.getLogger(InlineBlockSplitter.class);

    private int blocksMoved;

    /**
     * Splits {@code box} and its subtree. Any line box must be the only child of its container,
     * as the normalizer leaves it.
     *
     * @throws InvariantViolationException if a line box has siblings
     */
    public Box split(Box box) {
        blocksMoved = 0;
        Box result = splitSubtree(box);
        logger.debug("Moved {} block-level box(es) out of line boxes", blocksMoved);
        return result;
    }

    private Box splitSubtree(Box box) {
        if (!(box instanceof ParentBox parent)) {
            return box;
        }

        List<Box> children = parent.children();
        List<Box> newChildren = new ArrayList<>(children.size());
        boolean changed = false;

        for (Box child : children) {
            Box newChild;
            if (child instanceof LineBox line) {
                if (children.size() != 1) {
                    throw new InvariantViolationException(
                            "Line box in "
                                    + parent
                                    + " has "
                                    + (children.size() - 1)
                                    + " sibling(s)");
                }
                newChild = splitLine(parent, line, newChildren);
            } else {
                newChild = splitSubtree(child);
            }
            if (newChild != child) {
                changed = true;
            }
            newChildren.add(newChild);
        }

        return changed ? parent.copyWithChildren(newChildren) : parent;
    }

    /**
     * Appends every anonymous block and block-level box split out of {@code line} to {@code out}
     * and returns what takes the line's own place: the line itself (or a rebuilt copy) if no
     * block was found, otherwise the anonymous block holding the content after the last one.
     */
    private Box splitLine(ParentBox container, LineBox line, List<Box> out) {
        SplitCursor cursor = null;
        int found = 0;
        SearchResult result;
        while (true) {
            result = findBlock(line, cursor);
            if (result.block() == null) {
                break;
            }
            out.add(AnonymousBlockBox.wrapping(container, result.before()));
            out.add(splitSubtree(result.block()));
            cursor = result.resumeAt();
            found++;
        }

        if (found == 0) {
            return result.before();
        }
        blocksMoved += found;
        return AnonymousBlockBox.wrapping(container, result.before());
    }

    /**
     * Searches {@code box} from {@code cursor} for the first block-level box, walking into inline
     * boxes only.
     *
     * @param cursor where the previous search stopped, or null to start at the first child
     */
    SearchResult findBlock(ParentBox box, SplitCursor cursor) {
        ParentBox before = box.copyEmpty();
        boolean changed = false;
        int start = cursor != null ? cursor.index() : 0;
        List<Box> children = box.children();

        for (int i = start; i < children.size(); i++) {
            Box child = children.get(i);
            if (child.isBlockLevel()) {
                return new SearchResult(before, child, SplitCursor.at(i + 1));
            }

            Box newChild;
            if (child instanceof InlineBox inline) {
                // Only the child the cursor points into resumes mid-way.
                SplitCursor nested = (cursor != null && i == start) ? cursor.nested() : null;
                SearchResult inner = findBlock(inline, nested);
                newChild = inner.before();
                if (inner.block() != null) {
                    before.addChild(newChild);
                    return new SearchResult(
                            before, inner.block(), new SplitCursor(i, inner.resumeAt()));
                }
            } else if (child instanceof ParentBox) {
                // inline-block
                newChild = splitSubtree(child);
            } else {
                newChild = child;
            }

            if (newChild != child) {
                changed = true;
            }
            before.addChild(newChild);
        }

        if (!changed && cursor == null) {
            return new SearchResult(box, null, null);
        }
        return new SearchResult(before, null, null);
    }

    /**
     * One search step.
     *
     * @param before content preceding the found block, or all remaining content
     * @param block the block-level box found, or null once the line is exhausted
     * @param resumeAt where to continue after {@code block}, or null once exhausted
     */
    record SearchResult(ParentBox before, Box block, SplitCursor resumeAt) {}
}
