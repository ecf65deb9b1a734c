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

import net.boyechko.boxtree.BoxTestBase;
import net.boyechko.boxtree.box.AnonymousBlockBox;
import net.boyechko.boxtree.box.BlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.InlineBox;
import net.boyechko.boxtree.box.LineBox;
import net.boyechko.boxtree.box.TextBox;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.style.WhiteSpace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoxTreeCheckerTest extends BoxTestBase {

    private static final BoxTreeChecker NORMALIZED =
            new BoxTreeChecker(BoxTreeChecker.Stage.NORMALIZED);
    private static final BoxTreeChecker SPLIT = new BoxTreeChecker(BoxTreeChecker.Stage.SPLIT);

    private DocumentContext ctx;
    private BlockBox div;

    @BeforeEach
    void setUp() {
        ctx = context("<div><span/></div>");
        div = BlockBox.forElement(ctx, ctx.root());
    }

    @Test
    void pipelineOutputIsClean() {
        Box root =
                formattingStructure(
                        "<div>Intro <em>with<p>a block</p>inside</em>"
                                + "<ul><li>one</li><li style=\"list-style-position: inside\">two"
                                + "<span><p>nested</p></span></li></ul>"
                                + "<button>x<p>y</p></button> done</div>");

        IssueList issues = SPLIT.check(root);

        assertTrue(issues.isEmpty(), issues.describe());
    }

    @Test
    void lineBoxInsideAnInlineBoxIsMisplaced() {
        LineBox outer = LineBox.inside(div);
        InlineBox span = InlineBox.forElement(ctx, span());
        LineBox stray = LineBox.inside(span);
        stray.addChild(TextBox.inside(span, "x"));
        span.addChild(stray);
        outer.addChild(span);
        div.addChild(outer);

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.LINE_BOX_OUTSIDE_BLOCK_CONTAINER).size());
        assertNotNull(issues.get(0).where().path());
    }

    @Test
    void lineBoxDirectlyInsideALineBoxIsReported() {
        LineBox outer = LineBox.inside(div);
        LineBox inner = LineBox.inside(div);
        inner.addChild(TextBox.inside(div, "x"));
        outer.addChild(inner);
        div.addChild(outer);

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.NON_INLINE_IN_LINE_BOX).size());
        assertEquals(1, issues.ofType(IssueType.LINE_BOX_OUTSIDE_BLOCK_CONTAINER).size());
    }

    @Test
    void lineBoxWithSiblingsIsReported() {
        LineBox line = LineBox.inside(div);
        line.addChild(TextBox.inside(div, "x"));
        div.addChild(line);
        div.addChild(AnonymousBlockBox.inside(div));

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.LINE_BOX_WITH_SIBLINGS).size());
    }

    @Test
    void blocksInsideInlinesAreOnlyAnIssueAfterSplitting() {
        Box root = normalizedTree("<div><span>a<p>b</p></span></div>");

        assertTrue(NORMALIZED.check(root).isEmpty());
        assertEquals(1, SPLIT.check(root).ofType(IssueType.BLOCK_IN_LINE).size());
    }

    @Test
    void inlineBlocksAreOpaqueToTheBlockInLineCheck() {
        Box root = normalizedTree("<div>a<button>x<p>y</p></button></div>");

        assertTrue(SPLIT.check(root).isEmpty());
    }

    @Test
    void anonymousBoxWithItsOwnStyleIsReported() {
        div.addChild(
                new AnonymousBlockBox(
                        ctx, ctx.root(), div.style().withWhiteSpace(WhiteSpace.PRE_WRAP)));

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.ANONYMOUS_BOX_STYLE).size());
    }

    @Test
    void anonymousBoxesInheritingFromTheirContainerPass() {
        AnonymousBlockBox anon = AnonymousBlockBox.inside(div);
        LineBox line = LineBox.inside(anon);
        line.addChild(TextBox.inside(div, "x"));
        anon.addChild(line);
        div.addChild(anon);
        div.addChild(BlockBox.forElement(ctx, span()));

        assertTrue(NORMALIZED.check(div).isEmpty());
        assertEquals(ComputedStyle.inheritedFrom(div.style()), line.style());
    }

    @Test
    void outsideMarkerInTheFlowIsReported() {
        TextBox marker = TextBox.inside(div, "*");
        marker.inheritStyleFrom(div);
        div.setOutsideListMarker(marker);
        div.addChild(marker);

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.OUTSIDE_MARKER_IN_FLOW).size());
    }

    @Test
    void outsideMarkerOwnedByAnotherBoxIsReported() {
        TextBox marker = TextBox.inside(div, "*");
        marker.inheritStyleFrom(BlockBox.forElement(ctx, span()));
        div.setOutsideListMarker(marker);

        IssueList issues = NORMALIZED.check(div);

        assertEquals(1, issues.ofType(IssueType.OUTSIDE_MARKER_IN_FLOW).size());
    }

    private Element span() {
        return ctx.root().elementChildren().get(0);
    }
}
