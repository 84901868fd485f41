package net.convertcompress.application.apply;

/**
 * Asks the user whether a batch may overwrite existing files. Called at most once per
 * batch, before any processing.
 */
@FunctionalInterface
public interface OverwriteConfirmation {

    OverwriteConfirmation ALWAYS = summary -> true;
    OverwriteConfirmation NEVER = summary -> false;

    boolean confirmOverwrite(OverwriteSummary summary);
}
