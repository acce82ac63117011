package com.doks.git;

public record GitCommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String describeFailure() {
        if (launchFailed) {
            return "git could not be launched: " + stderr;
        }
        if (timedOut) {
            return "timed out, stderr=" + stderr;
        }
        if (interrupted) {
            return "interrupted";
        }
        return "exitCode=" + exitCode + " stderr=" + stderr;
    }
}
