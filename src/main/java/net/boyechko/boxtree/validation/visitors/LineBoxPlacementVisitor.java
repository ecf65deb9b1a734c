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
package net.boyechko.boxtree.validation.visitors;

import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.box.LineBox;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueLoc;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.validation.BoxVisitor;
import net.boyechko.boxtree.validation.VisitorContext;

/**
 * Line boxes belong directly in block containers, as their only child, and hold only
 * inline-level boxes.
 */
public class LineBoxPlacementVisitor implements BoxVisitor {

    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Line Box Placement Visitor";
    }

    @Override
    public String description() {
        return "Line boxes must be the only child of a block container";
    }

    @Override
    public boolean enterBox(VisitorContext ctx) {
        if (!(ctx.box() instanceof LineBox line)) {
            return true;
        }
        IssueLoc loc = IssueLoc.atBox(line, ctx.path());

        Box parent = ctx.parent();
        if (parent == null || !parent.isBlockContainer()) {
            issues.add(
                    new Issue(
                            IssueType.LINE_BOX_OUTSIDE_BLOCK_CONTAINER,
                            loc,
                            "Line box inside " + (parent == null ? "nothing" : parent)));
        } else if (childCount(parent) > 1) {
            issues.add(
                    new Issue(
                            IssueType.LINE_BOX_WITH_SIBLINGS,
                            loc,
                            "Line box has " + (childCount(parent) - 1) + " sibling(s)"));
        }

        for (Box child : line.children()) {
            if (!child.isInlineLevel()) {
                issues.add(
                        new Issue(
                                IssueType.NON_INLINE_IN_LINE_BOX,
                                loc,
                                "Line box directly contains " + child));
            }
        }
        return true;
    }

    private static int childCount(Box box) {
        return BoxTree.childrenOf(box).size();
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
