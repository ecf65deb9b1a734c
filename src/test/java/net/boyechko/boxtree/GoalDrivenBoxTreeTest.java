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
package net.boyechko.boxtree;

import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.document.XmlSource;
import net.boyechko.boxtree.image.ITextImageResolver;
import net.boyechko.boxtree.style.StylesheetStyleProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Goal-driven tests. Each case runs the whole pipeline on an XHTML document and compares the
 * resulting box tree against a hand-written goal dump.
 *
 * <p>Workflow for adding a new test case:
 *
 * <ol>
 *   <li>Write {@code src/test/resources/goals/foo.xhtml}
 *   <li>Work out the expected box tree and write it to {@code foo.goal.txt} in the format of
 *       {@link net.boyechko.boxtree.box.BoxTree#toIndentedTreeString}
 *   <li>Add "foo.xhtml" to the {@code @ValueSource} below
 * </ol>
 */
public class GoalDrivenBoxTreeTest extends BoxTestBase {

    private static final Path GOALS_DIR = Path.of("src/test/resources/goals");

    @ParameterizedTest(name = "build {0}")
    @ValueSource(
            strings = {
                "lists.xhtml",
                "block-in-inline.xhtml",
                "white-space.xhtml",
                "inline-block.xhtml",
            })
    @Tag("GoalDriven")
    void buildAndCompareToGoal(String documentName) throws Exception {
        Path inputPath = GOALS_DIR.resolve(documentName);
        assumeTrue(Files.exists(inputPath), "Input document not found: " + inputPath);

        String baseName = documentName.replace(".xhtml", "");
        Path goalFile = GOALS_DIR.resolve(baseName + ".goal.txt");
        assumeTrue(Files.exists(goalFile), "Goal dump not found: " + goalFile);

        Element root = XmlSource.parse(inputPath);
        DocumentContext ctx =
                new DocumentContext(
                        root,
                        inputPath.toAbsolutePath().toUri(),
                        StylesheetStyleProvider.withDefaultStylesheet(),
                        new ITextImageResolver(),
                        null);

        Box tree = formattingStructure(ctx);

        String actualTree = dump(tree).strip();
        String expectedTree = Files.readString(goalFile).strip();

        if (!expectedTree.equals(actualTree)) {
            fail(
                    "Box tree of "
                            + documentName
                            + " does not match goal "
                            + goalFile
                            + "\n\n"
                            + unifiedDiff(expectedTree, actualTree));
        }
    }

    private static String unifiedDiff(String expected, String actual) {
        List<String> goalLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(goalLines, actualLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff("goal", "actual", goalLines, patch, 2);
        return String.join("\n", diff);
    }
}
