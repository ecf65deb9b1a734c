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
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueLoc;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.validation.BoxVisitor;
import net.boyechko.boxtree.validation.VisitorContext;

/**
 * Anonymous boxes have no style of their own: theirs must be exactly what they inherit from the
 * nearest box generated by an element.
 */
public class AnonymousStyleVisitor implements BoxVisitor {

    private final IssueList issues = new IssueList();
    private final Deque<Box> styledAncestors = new ArrayDeque<>();

    @Override
    public String name() {
        return "Anonymous Style Visitor";
    }

    @Override
    public String description() {
        return "Anonymous boxes must inherit their style";
    }

    @Override
    public void beforeTraversal() {
        styledAncestors.clear();
    }

    @Override
    public boolean enterBox(VisitorContext ctx) {
        Box box = ctx.box();
        if (box.isAnonymous() && !ctx.outsideMarker() && !styledAncestors.isEmpty()) {
            ComputedStyle expected = ComputedStyle.inheritedFrom(styledAncestors.peek().style());
            if (!expected.equals(box.style())) {
                issues.add(
                        new Issue(
                                IssueType.ANONYMOUS_BOX_STYLE,
                                IssueLoc.atBox(box, ctx.path()),
                                box + " has style " + box.style() + ", expected " + expected));
            }
        }
        if (!box.isAnonymous() && !ctx.outsideMarker()) {
            styledAncestors.push(box);
        }
        return true;
    }

    @Override
    public void leaveBox(VisitorContext ctx) {
        if (!ctx.box().isAnonymous() && !ctx.outsideMarker()) {
            styledAncestors.pop();
        }
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
