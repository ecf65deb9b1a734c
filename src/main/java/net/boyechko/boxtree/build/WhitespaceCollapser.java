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

import java.util.regex.Pattern;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.TextBox;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.style.WhiteSpace;
import net.boyechko.boxtree.validation.BoxTreeWalker;
import net.boyechko.boxtree.validation.BoxVisitor;
import net.boyechko.boxtree.validation.VisitorContext;

/**
 * First part of the CSS 2.1 white-space processing model, applied to every non-empty text box
 * in document order according to its own {@code white-space} value. Text is rewritten in place.
 *
 * <p>A collapsible space at the end of one text box swallows a leading space of the next
 * collapsing text box, even across inline box boundaries. Preserving modes reset that state.
 * Outside list markers are left alone unless {@code collapseOutsideMarkers} is set; they are then
 * processed on their own, neither affected by nor affecting the surrounding text.
 */
public class WhitespaceCollapser implements BoxVisitor {

    private static final Pattern SPACES_AROUND_NEWLINE = Pattern.compile("[\t\r ]*\n[\t\r ]*");
    private static final Pattern PRESERVED_SPACE_BEFORE_BREAK =
            Pattern.compile("\u00A0([^\u00A0]|$)");
    private static final Pattern SPACE_RUN = Pattern.compile(" +");

    static final char NO_BREAK_SPACE = '\u00A0';
    static final String ZERO_WIDTH_SPACE = "\u200B";

    private final boolean collapseOutsideMarkers;
    private boolean followingCollapsibleSpace;

    public WhitespaceCollapser() {
        this(false);
    }

    public WhitespaceCollapser(boolean collapseOutsideMarkers) {
        this.collapseOutsideMarkers = collapseOutsideMarkers;
    }

    /** Processes all text below {@code root}; returns the same box. */
    public Box collapse(Box root) {
        new BoxTreeWalker(collapseOutsideMarkers).addVisitor(this).walk(root);
        return root;
    }

    /**
     * Applies the rules of {@code mode} to a single run of text, without regard to the text
     * before it.
     */
    public static String process(String text, WhiteSpace mode) {
        if (mode.collapsesSpaces()) {
            text = SPACES_AROUND_NEWLINE.matcher(text).replaceAll("\n");
            if (mode.collapsesNewlines()) {
                text = text.replace('\n', ' ');
            }
            text = text.replace('\t', ' ');
            return SPACE_RUN.matcher(text).replaceAll(" ");
        }

        text = text.replace(' ', NO_BREAK_SPACE);
        if (mode == WhiteSpace.PRE_WRAP) {
            text =
                    PRESERVED_SPACE_BEFORE_BREAK
                            .matcher(text)
                            .replaceAll(NO_BREAK_SPACE + ZERO_WIDTH_SPACE + "$1");
        }
        return text;
    }

    @Override
    public String name() {
        return "Whitespace Collapser";
    }

    @Override
    public String description() {
        return "Collapses white space in text boxes";
    }

    @Override
    public void beforeTraversal() {
        followingCollapsibleSpace = false;
    }

    @Override
    public boolean enterBox(VisitorContext ctx) {
        if (!(ctx.box() instanceof TextBox textBox) || textBox.text().isEmpty()) {
            return true;
        }

        WhiteSpace mode = textBox.style().whiteSpace();
        String text = process(textBox.text(), mode);

        if (ctx.outsideMarker()) {
            textBox.setText(text);
            return true;
        }

        if (mode.collapsesSpaces()) {
            if (followingCollapsibleSpace && text.startsWith(" ")) {
                text = text.substring(1);
            }
            followingCollapsibleSpace = text.endsWith(" ");
        } else {
            followingCollapsibleSpace = false;
        }
        textBox.setText(text);
        return true;
    }

    @Override
    public IssueList getIssues() {
        return new IssueList();
    }
}
