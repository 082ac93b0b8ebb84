package com.parsing.psg.util;

import com.parsing.psg.engine.DeadLoopWarning;
import com.parsing.psg.engine.EnumerationListener;
import com.parsing.psg.engine.ParsePath;

import java.util.Arrays;

/**
 * Aggregates multiple {@link EnumerationListener} instances, notifying them in
 * registration order.
 */
public class CompositeEnumerationListener implements EnumerationListener {
    private EnumerationListener[] listeners = new EnumerationListener[0];

    public CompositeEnumerationListener addForComposite(EnumerationListener listener) {
        EnumerationListener[] old = listeners;
        EnumerationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onEnumerationStart(String graphName, String entry) {
        for (EnumerationListener l : listeners)
            l.onEnumerationStart(graphName, entry);
    }

    @Override
    public void onPathFound(int index, ParsePath path) {
        for (EnumerationListener l : listeners)
            l.onPathFound(index, path);
    }

    @Override
    public void onDeadLoop(DeadLoopWarning warning) {
        for (EnumerationListener l : listeners)
            l.onDeadLoop(warning);
    }

    @Override
    public void onEnumerationEnd(int pathCount, int deadLoopCount) {
        for (EnumerationListener l : listeners)
            l.onEnumerationEnd(pathCount, deadLoopCount);
    }
}
