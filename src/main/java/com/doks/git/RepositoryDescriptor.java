package com.doks.git;

public record RepositoryDescriptor(String name, String cloneUrl, String branch, String folder) {

    public RepositoryDescriptor {
        if (cloneUrl == null || cloneUrl.isBlank()) {
            throw new IllegalArgumentException("cloneUrl must not be blank for repository '" + name + "'");
        }
        name = name == null || name.isBlank() ? cloneUrl : name;
    }

    public RepositoryDescriptor(String name, String cloneUrl) {
        this(name, cloneUrl, null, null);
    }
}
