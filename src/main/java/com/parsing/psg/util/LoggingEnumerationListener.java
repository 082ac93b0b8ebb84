package com.parsing.psg.util;

import com.parsing.psg.engine.DeadLoopWarning;
import com.parsing.psg.engine.EnumerationListener;
import com.parsing.psg.engine.ParsePath;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reports enumeration events through Log4j2.
 *
 * <p>
 * Dead loops are logged at WARN with the partial path that led to them; found
 * paths at DEBUG; the start and end of an enumeration at INFO.
 */
public final class LoggingEnumerationListener implements EnumerationListener {
    private static final Logger log = LogManager.getLogger(LoggingEnumerationListener.class);

    private String graphName = "";

    @Override
    public void onEnumerationStart(String graphName, String entry) {
        this.graphName = graphName;
        log.info("Finding paths in '{}' from '{}'", graphName, entry);
    }

    @Override
    public void onPathFound(int index, ParsePath path) {
        log.debug("[{}] path #{}: {}", graphName, index, path);
    }

    @Override
    public void onDeadLoop(DeadLoopWarning warning) {
        log.warn("[{}] Loop without exit or loop whose all states and branches have already been added "
                + "to the path detected. Ignoring the parse subtree: {}", graphName, warning.path());
    }

    @Override
    public void onEnumerationEnd(int pathCount, int deadLoopCount) {
        log.info("[{}] {} paths found, {} subtrees ignored", graphName, pathCount, deadLoopCount);
    }
}
