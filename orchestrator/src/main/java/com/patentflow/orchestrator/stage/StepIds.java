package com.patentflow.orchestrator.stage;

/**
 * Step id helpers.
 *
 * A step id is "<reference>-<prefix>-<run>", e.g. "PAT-7-R2R-3". The run number
 * is the stage's run_count after admission, which never resets, so an id never
 * repeats for a stage. Everything before the last '-' is the generation prefix
 * shared by every run of the stage on that record.
 */
public final class StepIds {

    private StepIds() {}

    public static String mint(String reference, String stagePrefix, int runNumber) {
        if (runNumber <= 0) {
            throw new IllegalArgumentException("runNumber must be positive (current: " + runNumber + ")");
        }
        return reference + "-" + stagePrefix + "-" + runNumber;
    }

    /** "PAT-7-R2R-3" → "PAT-7-R2R" */
    public static String prefixOf(String stepId) {
        int cut = stepId.lastIndexOf('-');
        if (cut <= 0) {
            throw new IllegalArgumentException("Not a step id: " + stepId);
        }
        return stepId.substring(0, cut);
    }
}
