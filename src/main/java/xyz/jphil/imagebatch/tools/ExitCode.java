package xyz.jphil.imagebatch.tools;

/**
 * Process exit codes of the {@code imagebatch} command.
 */
public final class ExitCode {
    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int INVALID_INPUT = 2;

    private ExitCode() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ExitCode.class.getName()));
    }
}
