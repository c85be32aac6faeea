package com.repopal.orchestrator.command;

public class UnknownCommandException extends RuntimeException {
    public UnknownCommandException(String name) {
        super("No command registered with name: '" + name + "'");
    }
}
