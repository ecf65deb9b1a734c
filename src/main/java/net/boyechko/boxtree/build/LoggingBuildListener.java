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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.BoxTree;
import net.boyechko.boxtree.issue.Issue;
import org.slf4j.LoggerFactory;

/** A {@link BuildListener} that routes all events through SLF4J. */
public class LoggingBuildListener implements BuildListener {

    private static final String CONSOLE_APPENDER_NAME = "BOXTREE_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.boxtree.build.pipeline");

    private final boolean dumpTrees;

    public LoggingBuildListener() {
        this(false);
    }

    /** With {@code dumpTrees}, the tree after every stage is logged at debug level. */
    public LoggingBuildListener(boolean dumpTrees) {
        this.dumpTrees = dumpTrees;
    }

    /** Creates a {@link LoggingBuildListener} and ensures logs are emitted to stdout. */
    public static LoggingBuildListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingBuildListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-24logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onStageStart(String stageName) {
        logger.info("STAGE {}", stageName);
    }

    @Override
    public void onStageComplete(String stageName, Box root) {
        if (dumpTrees && logger.isDebugEnabled()) {
            logger.debug("Tree after {}:\n{}", stageName, BoxTree.toIndentedTreeString(root));
        }
    }

    @Override
    public void onIssue(Issue issue) {
        logger.error("ISSUE [{}] {}", issue.type().groupLabel(), issue);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }
}
