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
package net.boyechko.boxtree.issue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.stream.Collectors;

/** List of issues found in a box tree. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    /** Returns the issues of the given type, in the order found. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** One issue per line, for exception messages and logs. */
    public String describe() {
        return stream().map(Issue::toString).collect(Collectors.joining("\n"));
    }
}
