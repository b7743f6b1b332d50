package com.platform.patchwatch.error;

/**
 * A remote command ran but exited unsuccessfully, or exceeded its execution timeout.
 */
public class CommandFailedException extends PatchWatchException {

    private final String command;
    private final int exitCode;
    private final String stderr;

    public CommandFailedException(String command, int exitCode, String stderr) {
        super(ErrorCode.COMMAND_FAILED,
            String.format("Command '%s' exited with status %d: %s", command, exitCode, summarize(stderr)));
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    private CommandFailedException(ErrorCode errorCode, String command, String message) {
        super(errorCode, message);
        this.command = command;
        this.exitCode = -1;
        this.stderr = "";
    }

    public static CommandFailedException timeout(String command, long timeoutMs) {
        return new CommandFailedException(ErrorCode.COMMAND_TIMEOUT, command,
            String.format("Command '%s' did not finish within %dms", command, timeoutMs));
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }

    public boolean isTimeout() {
        return getErrorCode() == ErrorCode.COMMAND_TIMEOUT;
    }

    private static String summarize(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "(no error output)";
        }
        String trimmed = stderr.strip();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }
}
