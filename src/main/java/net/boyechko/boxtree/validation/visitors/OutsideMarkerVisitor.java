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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueLoc;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.validation.BoxVisitor;
import net.boyechko.boxtree.validation.VisitorContext;

/**
 * Outside list markers hang off their box: they are never also in the normal flow, and they take
 * their style from the box that owns them. Needs a walk that includes outside markers.
 */
public class OutsideMarkerVisitor implements BoxVisitor {

    private final IssueList issues = new IssueList();
    private final Set<Box> inFlow = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Box, String> markers = new IdentityHashMap<>();

    @Override
    public String name() {
        return "Outside Marker Visitor";
    }

    @Override
    public String description() {
        return "Outside list markers must stay out of the normal flow";
    }

    @Override
    public void beforeTraversal() {
        inFlow.clear();
        markers.clear();
    }

    @Override
    public boolean enterBox(VisitorContext ctx) {
        Box box = ctx.box();
        if (!ctx.outsideMarker()) {
            inFlow.add(box);
            return true;
        }

        markers.put(box, ctx.path());
        if (box.styleParent() != ctx.parent()) {
            issues.add(
                    new Issue(
                            IssueType.OUTSIDE_MARKER_IN_FLOW,
                            IssueLoc.atBox(box, ctx.path()),
                            "Outside marker does not inherit its style from " + ctx.parent()));
        }
        return true;
    }

    @Override
    public void afterTraversal() {
        for (Map.Entry<Box, String> marker : markers.entrySet()) {
            if (inFlow.contains(marker.getKey())) {
                issues.add(
                        new Issue(
                                IssueType.OUTSIDE_MARKER_IN_FLOW,
                                IssueLoc.atBox(marker.getKey(), marker.getValue()),
                                "Outside marker " + marker.getKey() + " is also a child box"));
            }
        }
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
