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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.boxtree.BoxTestBase;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.InlineBox;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueType;
import org.junit.jupiter.api.Test;

class BoxTreeWalkerTest extends BoxTestBase {

    /** Records the traversal; optionally refuses to descend into inline boxes. */
    static class RecordingVisitor implements BoxVisitor {
        final List<String> events = new ArrayList<>();
        final List<VisitorContext> contexts = new ArrayList<>();
        private final boolean skipInlineBoxes;

        RecordingVisitor(boolean skipInlineBoxes) {
            this.skipInlineBoxes = skipInlineBoxes;
        }

        @Override
        public String name() {
            return "Recording Visitor";
        }

        @Override
        public String description() {
            return "Records every box it sees";
        }

        @Override
        public void beforeTraversal() {
            events.add("before");
        }

        @Override
        public boolean enterBox(VisitorContext ctx) {
            contexts.add(ctx);
            events.add("enter " + ctx.box());
            return !(skipInlineBoxes && ctx.box() instanceof InlineBox);
        }

        @Override
        public void leaveBox(VisitorContext ctx) {
            events.add("leave " + ctx.box());
        }

        @Override
        public void afterTraversal() {
            events.add("after");
        }

        @Override
        public IssueList getIssues() {
            return new IssueList();
        }
    }

    @Test
    void visitsBoxesInDocumentOrder() {
        RecordingVisitor visitor = new RecordingVisitor(false);

        new BoxTreeWalker().addVisitor(visitor).walk(buildTree("<p>a<em>b</em></p>"));

        assertEquals(
                List.of(
                        "before",
                        "enter BlockBox <p>",
                        "enter TextBox \"a\"",
                        "leave TextBox \"a\"",
                        "enter InlineBox <em>",
                        "enter TextBox \"b\"",
                        "leave TextBox \"b\"",
                        "leave InlineBox <em>",
                        "leave BlockBox <p>",
                        "after"),
                visitor.events);
    }

    @Test
    void returningFalseSkipsChildren() {
        RecordingVisitor visitor = new RecordingVisitor(true);

        new BoxTreeWalker().addVisitor(visitor).walk(buildTree("<p>a<em>b</em></p>"));

        assertFalse(visitor.events.contains("enter TextBox \"b\""));
        assertTrue(visitor.events.contains("leave InlineBox <em>"));
    }

    @Test
    void outsideMarkersAreSkippedUnlessRequested() {
        Box ul = buildTree("<ul><li>x</li></ul>");

        RecordingVisitor without = new RecordingVisitor(false);
        new BoxTreeWalker().addVisitor(without).walk(ul);
        assertTrue(without.contexts.stream().noneMatch(VisitorContext::outsideMarker));

        RecordingVisitor with = new RecordingVisitor(false);
        new BoxTreeWalker(true).addVisitor(with).walk(ul);
        VisitorContext marker = with.contexts.get(2);
        assertTrue(marker.outsideMarker());
        assertSame(with.contexts.get(1).box(), marker.parent());
        assertEquals("enter TextBox \"x\"", with.events.get(5));
    }

    @Test
    void contextsCarryPathDepthAndIndex() {
        RecordingVisitor visitor = new RecordingVisitor(false);

        new BoxTreeWalker().addVisitor(visitor).walk(normalizedTree("<div><p>a</p></div>"));

        VisitorContext text = visitor.contexts.get(3);
        assertEquals("/BlockBox<div>[1].BlockBox<p>[2].LineBox[3].TextBox[4]", text.path());
        assertEquals(3, text.depth());
        assertEquals(4, text.globalIndex());
        assertTrue(visitor.contexts.get(0).isRoot());
        assertFalse(text.isRoot());
    }

    @Test
    void collectsIssuesFromEveryVisitor() {
        BoxVisitor complaining =
                new BoxVisitor() {
                    private final IssueList issues = new IssueList();

                    @Override
                    public String name() {
                        return "Complaining Visitor";
                    }

                    @Override
                    public String description() {
                        return "Reports every box";
                    }

                    @Override
                    public boolean enterBox(VisitorContext ctx) {
                        issues.add(new Issue(IssueType.BLOCK_IN_LINE, "at " + ctx.path()));
                        return true;
                    }

                    @Override
                    public IssueList getIssues() {
                        return issues;
                    }
                };

        IssueList issues =
                new BoxTreeWalker()
                        .addVisitor(new RecordingVisitor(false))
                        .addVisitor(complaining)
                        .walk(buildTree("<p>a</p>"));

        assertEquals(2, issues.size());
    }

    @Test
    void visitorFailuresPropagate() {
        BoxVisitor failing =
                new BoxVisitor() {
                    @Override
                    public String name() {
                        return "Failing Visitor";
                    }

                    @Override
                    public String description() {
                        return "Always fails";
                    }

                    @Override
                    public boolean enterBox(VisitorContext ctx) {
                        throw new IllegalStateException("boom");
                    }

                    @Override
                    public IssueList getIssues() {
                        return new IssueList();
                    }
                };

        assertThrows(
                IllegalStateException.class,
                () -> new BoxTreeWalker().addVisitor(failing).walk(buildTree("<p>a</p>")));
    }
}
