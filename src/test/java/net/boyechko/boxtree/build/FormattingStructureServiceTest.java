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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.boxtree.BoxTestBase;
import net.boyechko.boxtree.box.AnonymousBlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueType;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.style.StylesheetStyleProvider;
import net.boyechko.boxtree.style.WhiteSpace;
import org.junit.jupiter.api.Test;

class FormattingStructureServiceTest extends BoxTestBase {

    @Test
    void paragraphWithEmphasisBecomesOneLine() {
        Box root = formattingStructure("<p>Some <em>emphasised</em> text.</p>");

        assertEquals(
                lines(
                        "BlockBox <p>",
                        "  LineBox",
                        "    TextBox \"Some \"",
                        "    InlineBox <em>",
                        "      TextBox \"emphasised\"",
                        "    TextBox \" text.\""),
                dump(root));
    }

    @Test
    void pendingSpaceIsThreadedAcrossTheWholeDocument() {
        Box root =
                formattingStructure(
                        "<html><head><title>ignored</title></head>\n"
                                + "<body>\n  <p>Hello <span>big\n  <div>wide</div>\n"
                                + "  world</span></p>\n</body></html>");

        assertEquals(
                lines(
                        "BlockBox <html>",
                        "  AnonymousBlockBox",
                        "    LineBox",
                        "      TextBox \" \"",
                        "  BlockBox <body>",
                        "    AnonymousBlockBox",
                        "      LineBox",
                        "        TextBox \"\"",
                        "    BlockBox <p>",
                        "      AnonymousBlockBox",
                        "        LineBox",
                        "          TextBox \"Hello \"",
                        "          InlineBox <span>",
                        "            TextBox \"big \"",
                        "      BlockBox <div>",
                        "        LineBox",
                        "          TextBox \"wide\"",
                        "      AnonymousBlockBox",
                        "        LineBox",
                        "          InlineBox <span>",
                        "            TextBox \" world\"",
                        "    AnonymousBlockBox",
                        "      LineBox",
                        "        TextBox \" \""),
                dump(root));
    }

    @Test
    void noDescendantOfAHiddenElementSurvives() {
        DocumentContext ctx =
                context(
                        "<div><p id=\"shown\">a</p><section style=\"display: none\">"
                                + "<p id=\"hidden\">b<em>c</em></p></section></div>");

        Box root = formattingStructure(ctx);

        for (Box box : BoxTree.descendants(root, true)) {
            Element element = box.element();
            assertNotEquals("section", element.name());
            assertNotEquals("hidden", element.attribute("id"));
            assertNotEquals("em", element.name());
        }
    }

    @Test
    void hiddenRootIsRejected() {
        DocumentContext ctx = context("<head><title>t</title></head>");

        assertThrows(
                IllegalArgumentException.class,
                () -> FormattingStructureService.builder().build().build(ctx));
    }

    @Test
    void unsupportedDisplayAbortsTheBuild() {
        DocumentContext ctx = context("<div>a<span style=\"display: run-in\">b</span></div>");

        UnsupportedDisplayException e =
                assertThrows(
                        UnsupportedDisplayException.class,
                        () -> FormattingStructureService.builder().build().build(ctx));
        assertEquals("run-in", e.value());
    }

    @Test
    void listenerSeesEveryStageInOrder() {
        List<String> events = new ArrayList<>();
        BuildListener listener =
                new BuildListener() {
                    @Override
                    public void onStageStart(String stageName) {
                        events.add("start " + stageName);
                    }

                    @Override
                    public void onStageComplete(String stageName, Box root) {
                        events.add("done " + stageName);
                    }
                };

        FormattingStructureService.builder()
                .withListener(listener)
                .build()
                .build(context("<p>x</p>"));

        assertEquals(
                List.of(
                        "start " + FormattingStructureService.STAGE_BUILD,
                        "done " + FormattingStructureService.STAGE_BUILD,
                        "start " + FormattingStructureService.STAGE_NORMALIZE,
                        "done " + FormattingStructureService.STAGE_NORMALIZE,
                        "start " + FormattingStructureService.STAGE_SPLIT,
                        "done " + FormattingStructureService.STAGE_SPLIT,
                        "start " + FormattingStructureService.STAGE_WHITESPACE,
                        "done " + FormattingStructureService.STAGE_WHITESPACE),
                events);
    }

    @Test
    void invariantChecksReportMalformedTrees() {
        List<Issue> reported = new ArrayList<>();
        BuildListener listener =
                new BuildListener() {
                    @Override
                    public void onIssue(Issue issue) {
                        reported.add(issue);
                    }
                };
        DocumentContext ctx = withBadAnonymousBox();

        FormattingStructureService service =
                FormattingStructureService.builder()
                        .withListener(listener)
                        .withOptions(BuildOptions.builder().withVerifyInvariants(true).build())
                        .build();

        InvariantViolationException e =
                assertThrows(InvariantViolationException.class, () -> service.build(ctx));
        assertEquals(1, e.getIssues().ofType(IssueType.ANONYMOUS_BOX_STYLE).size());
        assertEquals(e.getIssues(), reported);
    }

    @Test
    void invariantChecksAreOffUnlessEnabled() {
        FormattingStructureService service =
                FormattingStructureService.builder()
                        .withOptions(BuildOptions.builder().withVerifyInvariants(false).build())
                        .build();

        assertDoesNotThrow(() -> service.build(withBadAnonymousBox()));
    }

    @Test
    void loggingListenerCanBeUsedAsIs() {
        Box root =
                FormattingStructureService.builder()
                        .withListener(new LoggingBuildListener(true))
                        .build()
                        .build(context("<p>x</p>"));

        assertNotNull(root);
    }

    /** A handler that plants an anonymous block whose style was not inherited. */
    private static DocumentContext withBadAnonymousBox() {
        Element root = parse("<div>a<x/>b</div>");
        ElementHandler handler =
                (ctx, element) ->
                        element.name().equals("x")
                                ? HandlerResult.replaceWith(
                                        new AnonymousBlockBox(
                                                ctx,
                                                element,
                                                ComputedStyle.INITIAL.withWhiteSpace(
                                                        WhiteSpace.PRE)))
                                : HandlerResult.defaultHandling();
        return new DocumentContext(
                root, null, StylesheetStyleProvider.withDefaultStylesheet(), null, handler);
    }
}
