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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.issue.IssueList;
import net.boyechko.boxtree.validation.visitors.AnonymousStyleVisitor;
import net.boyechko.boxtree.validation.visitors.BlockInLineVisitor;
import net.boyechko.boxtree.validation.visitors.LineBoxPlacementVisitor;
import net.boyechko.boxtree.validation.visitors.OutsideMarkerVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structural rules a box tree must satisfy after a pipeline stage. Each check is a
 * {@link BoxVisitor}; all of them run in a single walk that includes outside markers.
 */
public class BoxTreeChecker {
    private static final Logger logger = LoggerFactory.getLogger(BoxTreeChecker.class);

    /** The pipeline stage whose output is being checked. */
    public enum Stage {
        /** Line boxes are in place; block-level boxes may still sit inside inline boxes. */
        NORMALIZED,
        /** No block-level box remains inside a line box. */
        SPLIT
    }

    private final Stage stage;
    private final List<Supplier<BoxVisitor>> visitorSuppliers;

    public BoxTreeChecker(Stage stage) {
        this.stage = stage;
        this.visitorSuppliers = visitorSuppliers(stage);
    }

    static List<Supplier<BoxVisitor>> visitorSuppliers(Stage stage) {
        List<Supplier<BoxVisitor>> suppliers = new ArrayList<>();
        suppliers.add(LineBoxPlacementVisitor::new);
        suppliers.add(AnonymousStyleVisitor::new);
        suppliers.add(OutsideMarkerVisitor::new);
        if (stage == Stage.SPLIT) {
            suppliers.add(BlockInLineVisitor::new);
        }
        return suppliers;
    }

    public Stage stage() {
        return stage;
    }

    /** Returns every violation found; an empty list means the tree is well formed. */
    public IssueList check(Box root) {
        BoxTreeWalker walker = new BoxTreeWalker(true);
        for (Supplier<BoxVisitor> supplier : visitorSuppliers) {
            walker.addVisitor(supplier.get());
        }
        IssueList issues = walker.walk(root);
        logger.debug("Checked {} tree: {} issue(s)", stage, issues.size());
        return issues;
    }
}
