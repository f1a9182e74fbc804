package com.dataflow.memo.util;

import com.dataflow.memo.api.EvaluationListener;

import java.util.Arrays;

/**
 * Fans every callback out to several {@link EvaluationListener}s, in the
 * order they were added.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public CompositeEvaluationListener add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onComputeStart(long epoch, int targetIndex) {
        for (EvaluationListener l : listeners)
            l.onComputeStart(epoch, targetIndex);
    }

    @Override
    public void onNodeEvaluated(long epoch, int nodeIndex, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeEvaluated(epoch, nodeIndex, durationNanos);
    }

    @Override
    public void onNodeError(long epoch, int nodeIndex, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(epoch, nodeIndex, error);
    }

    @Override
    public void onComputeEnd(long epoch, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onComputeEnd(epoch, nodesEvaluated);
    }

    @Override
    public void onInvalidated(int originIndex, int staleCount) {
        for (EvaluationListener l : listeners)
            l.onInvalidated(originIndex, staleCount);
    }
}
