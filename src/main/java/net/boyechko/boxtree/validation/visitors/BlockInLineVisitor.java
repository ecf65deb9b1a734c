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

import java.util.ArrayDeque;
import java.util.Deque;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.InlineBox;
import net.boyechko.boxtree.box.LineBox;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueLoc;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.validation.BoxVisitor;
import net.boyechko.boxtree.validation.VisitorContext;

/**
 * No block-level box may sit inside a line box, directly or through inline boxes. Inline-block
 * boxes start a context of their own and are not searched.
 */
public class BlockInLineVisitor implements BoxVisitor {

    private final IssueList issues = new IssueList();

    /** For each open box: whether its children are in an inline formatting context. */
    private final Deque<Boolean> inLine = new ArrayDeque<>();

    @Override
    public String name() {
        return "Block In Line Visitor";
    }

    @Override
    public String description() {
        return "Line boxes must not contain block-level boxes";
    }

    @Override
    public void beforeTraversal() {
        inLine.clear();
    }

    @Override
    public boolean enterBox(VisitorContext ctx) {
        Box box = ctx.box();
        boolean parentInLine = !ctx.outsideMarker() && !inLine.isEmpty() && inLine.peek();
        if (parentInLine && box.isBlockLevel()) {
            issues.add(
                    new Issue(
                            IssueType.BLOCK_IN_LINE,
                            IssueLoc.atBox(box, ctx.path()),
                            box + " is inside a line box"));
        }

        if (box instanceof LineBox) {
            inLine.push(true);
        } else if (box instanceof InlineBox) {
            inLine.push(parentInLine);
        } else {
            inLine.push(false);
        }
        return true;
    }

    @Override
    public void leaveBox(VisitorContext ctx) {
        inLine.pop();
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
