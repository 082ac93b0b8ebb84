package com.parsing.psg.util;

import com.parsing.psg.engine.DeadLoopWarning;
import com.parsing.psg.engine.EnumerationListener;
import com.parsing.psg.engine.ParsePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records every event in order. Useful for diagnostics and tests.
 */
public final class CollectingEnumerationListener implements EnumerationListener {
    private final List<ParsePath> paths = new ArrayList<>();
    private final List<DeadLoopWarning> deadLoops = new ArrayList<>();
    private int started, ended;

    @Override
    public void onEnumerationStart(String graphName, String entry) {
        started++;
    }

    @Override
    public void onPathFound(int index, ParsePath path) {
        paths.add(path);
    }

    @Override
    public void onDeadLoop(DeadLoopWarning warning) {
        deadLoops.add(warning);
    }

    @Override
    public void onEnumerationEnd(int pathCount, int deadLoopCount) {
        ended++;
    }

    public List<ParsePath> paths() {
        return Collections.unmodifiableList(paths);
    }

    public List<DeadLoopWarning> deadLoops() {
        return Collections.unmodifiableList(deadLoops);
    }

    public int startedCount() {
        return started;
    }

    public int endedCount() {
        return ended;
    }

    public void clear() {
        paths.clear();
        deadLoops.clear();
        started = 0;
        ended = 0;
    }
}
