package com.bookforge.model;

import lombok.Value;

import java.util.Locale;

/**
 * One line of the execution report: how a single pipeline step ended.
 */
@Value
public class StepReport {

    public enum Status {
        SUCCESS, FAILED, SKIPPED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    String name;
    Status status;
    long durationMillis;
    String artifact;
    String error;

    public static StepReport success(String name, long durationMillis, String artifact) {
        return new StepReport(name, Status.SUCCESS, durationMillis, artifact, null);
    }

    public static StepReport failed(String name, long durationMillis, String error) {
        return new StepReport(name, Status.FAILED, durationMillis, null, error);
    }

    public static StepReport skipped(String name) {
        return new StepReport(name, Status.SKIPPED, 0L, null, null);
    }
}
