package com.bookforge.config;

/**
 * Defines which stages a pipeline run executes.
 */
public enum PipelineMode {

    /**
     * Cleaning followed by feature engineering. The cleaned table is handed to the
     * feature stage in memory and also persisted to the processed output.
     */
    FULL,

    /**
     * Cleaning only: reads the raw input and writes the processed output.
     */
    CLEANING_ONLY,

    /**
     * Feature engineering only: reads a previously written processed output.
     */
    FEATURES_ONLY;

    public boolean runsCleaning() {
        return this != FEATURES_ONLY;
    }

    public boolean runsFeatures() {
        return this != CLEANING_ONLY;
    }
}
