package com.repopal.orchestrator.executor.dto;

/**
 * One file-level difference between the original commit and the working tree.
 */
public record FileChange(String path, Status status) {

    public enum Status { ADDED, MODIFIED, DELETED }

    public static FileChange modified(String path) { return new FileChange(path, Status.MODIFIED); }
    public static FileChange added(String path)    { return new FileChange(path, Status.ADDED); }
    public static FileChange deleted(String path)  { return new FileChange(path, Status.DELETED); }
}
