package com.wiregen.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** I/O or configuration failure. */
    public static final int FAILURE = 1;

    /** Error diagnostics were reported and the command was asked to fail on them. */
    public static final int DIAGNOSTIC_ERRORS = 2;

    private ExitCodes() {
    }
}
