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
package net.boyechko.boxtree.validation;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.boxtree.box.BlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a box tree once in document order, invoking multiple visitors at each box. Outside list
 * markers are skipped unless requested; when included, a marker is visited right after its box
 * and before the box's children.
 */
public class BoxTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(BoxTreeWalker.class);

    private final List<BoxVisitor> visitors = new ArrayList<>();
    private final boolean includeOutsideMarkers;

    private DocumentContext docCtx;
    private int globalIndex;

    public BoxTreeWalker() {
        this(false);
    }

    public BoxTreeWalker(boolean includeOutsideMarkers) {
        this.includeOutsideMarkers = includeOutsideMarkers;
    }

    public BoxTreeWalker addVisitor(BoxVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(Box root) {
        return walk(root, root.document());
    }

    public IssueList walk(Box root, DocumentContext docCtx) {
        this.docCtx = docCtx;
        this.globalIndex = 0;

        for (BoxVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkBox(root, null, "/", 0, false);

        IssueList allIssues = new IssueList();
        for (BoxVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    private void walkBox(Box box, Box parent, String parentPath, int depth, boolean marker) {
        globalIndex++;
        VisitorContext ctx =
                new VisitorContext(
                        box,
                        parent,
                        parentPath + segment(box, marker),
                        depth,
                        globalIndex,
                        marker,
                        docCtx);

        boolean continueToChildren = true;
        for (BoxVisitor visitor : visitors) {
            try {
                if (!visitor.enterBox(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
                throw e;
            }
        }

        if (includeOutsideMarkers
                && box instanceof BlockBox block
                && block.hasOutsideListMarker()) {
            walkBox(block.outsideListMarker(), box, ctx.path() + ".", depth + 1, true);
        }

        if (continueToChildren) {
            for (Box child : BoxTree.childrenOf(box)) {
                walkBox(child, box, ctx.path() + ".", depth + 1, false);
            }
        }

        for (BoxVisitor visitor : visitors) {
            try {
                visitor.leaveBox(ctx);
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
                throw e;
            }
        }
    }

    private String segment(Box box, boolean marker) {
        String name = box.getClass().getSimpleName();
        if (marker) {
            name = "::marker";
        } else if (!box.isAnonymous() && box.element() != null && box.isParent()) {
            name += "<" + box.element().name() + ">";
        }
        return name + "[" + globalIndex + "]";
    }
}
