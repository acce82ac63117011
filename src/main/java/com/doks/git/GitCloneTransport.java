package com.doks.git;

public enum GitCloneTransport {
    SSH,
    HTTPS;

    public String cloneUrl(String server, String repositoryName) {
        return switch (this) {
            case SSH -> "git@" + server + ":" + repositoryName + ".git";
            case HTTPS -> "https://" + server + "/" + repositoryName + ".git";
        };
    }
}
