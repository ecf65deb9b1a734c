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

import net.boyechko.boxtree.issue.IssueList;

/**
 * A box tree broke a structural rule one of the pipeline stages relies on. This is a bug in the
 * pipeline (or in a box handed to it), never a problem with the input document.
 */
public class InvariantViolationException extends IllegalStateException {
    private final IssueList issues;

    public InvariantViolationException(String message) {
        this(message, new IssueList());
    }

    public InvariantViolationException(String message, IssueList issues) {
        super(message);
        this.issues = issues;
    }

    /** Violations found by a tree check; empty when raised directly by a stage. */
    public IssueList getIssues() {
        return issues;
    }
}
