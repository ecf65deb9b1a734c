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

import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.issue.Issue;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.validation.BoxTreeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the formatting structure of a document: box construction, line boxes, block-in-inline
 * splitting and white-space processing, in that order.
 */
public class FormattingStructureService {
    private static final Logger logger = LoggerFactory.getLogger(FormattingStructureService.class);

    static final String STAGE_BUILD = "Box construction";
    static final String STAGE_NORMALIZE = "Inline content in blocks";
    static final String STAGE_SPLIT = "Blocks in inline content";
    static final String STAGE_WHITESPACE = "White-space processing";

    private final BuildListener listener;
    private final BuildOptions options;

    public static class FormattingStructureServiceBuilder {
        private BuildListener listener;
        private BuildOptions options;

        public FormattingStructureServiceBuilder withListener(BuildListener listener) {
            this.listener = listener;
            return this;
        }

        public FormattingStructureServiceBuilder withOptions(BuildOptions options) {
            this.options = options;
            return this;
        }

        public FormattingStructureService build() {
            return new FormattingStructureService(this);
        }
    }

    private FormattingStructureService(FormattingStructureServiceBuilder builder) {
        this.listener = builder.listener != null ? builder.listener : BuildListener.none();
        this.options = builder.options != null ? builder.options : BuildOptions.defaults();
    }

    public static FormattingStructureServiceBuilder builder() {
        return new FormattingStructureServiceBuilder();
    }

    public BuildOptions options() {
        return options;
    }

    /**
     * Builds the box tree for the document's root element.
     *
     * @throws IllegalArgumentException if the root element is not displayed
     * @throws UnsupportedDisplayException if an element has a display value boxes cannot be built
     *     for
     * @throws InvariantViolationException if invariant checks are enabled and a stage produced a
     *     malformed tree
     */
    public Box build(DocumentContext ctx) {
        logger.debug("Building formatting structure for {} with {}", ctx.root(), options);

        listener.onStageStart(STAGE_BUILD);
        Box root =
                new TreeBuilder(ctx)
                        .build(ctx.root())
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Root element "
                                                        + ctx.root()
                                                        + " generates no box"));
        listener.onStageComplete(STAGE_BUILD, root);

        listener.onStageStart(STAGE_NORMALIZE);
        root = new InlineBlockNormalizer().normalize(root);
        listener.onStageComplete(STAGE_NORMALIZE, root);
        verify(root, BoxTreeChecker.Stage.NORMALIZED);

        listener.onStageStart(STAGE_SPLIT);
        root = new InlineBlockSplitter().split(root);
        listener.onStageComplete(STAGE_SPLIT, root);
        verify(root, BoxTreeChecker.Stage.SPLIT);

        listener.onStageStart(STAGE_WHITESPACE);
        root = new WhitespaceCollapser(options.collapseOutsideMarkers()).collapse(root);
        listener.onStageComplete(STAGE_WHITESPACE, root);

        if (logger.isTraceEnabled()) {
            logger.trace("Formatting structure:\n{}", BoxTree.toIndentedTreeString(root));
        }
        return root;
    }

    private void verify(Box root, BoxTreeChecker.Stage stage) {
        if (!options.verifyInvariants()) {
            return;
        }
        IssueList issues = new BoxTreeChecker(stage).check(root);
        if (issues.isEmpty()) {
            listener.onVerboseOutput("No invariant violations after stage " + stage);
            return;
        }
        for (Issue issue : issues) {
            listener.onIssue(issue);
        }
        logger.error("{} invariant violation(s) after stage {}", issues.size(), stage);
        throw new InvariantViolationException(
                issues.size() + " invariant violation(s) after stage " + stage + ":\n"
                        + issues.describe(),
                issues);
    }
}
