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

import net.boyechko.boxtree.issue.IssueList;

/** Visitor interface for box tree traversal. */
public interface BoxVisitor {

    String name();

    String description();

    /** Returns false to skip the children of the box. Outside markers are always visited. */
    default boolean enterBox(VisitorContext ctx) {
        return true;
    }

    default void leaveBox(VisitorContext ctx) {}

    default void beforeTraversal() {}

    default void afterTraversal() {}

    IssueList getIssues();
}
