package com.fillline.scheduler.engine;

/**
 * Optional side channel for long planning runs. Listeners observe progress only; they cannot
 * influence the plan.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
