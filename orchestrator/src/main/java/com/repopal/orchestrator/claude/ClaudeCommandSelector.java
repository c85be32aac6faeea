package com.repopal.orchestrator.claude;

import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.capability.CommandSelector;
import com.repopal.orchestrator.claude.ClaudeClient.Message;
import com.repopal.orchestrator.command.CommandManifest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks Claude which command a request wants.
 */
@Component
public class ClaudeCommandSelector implements CommandSelector {

    static final String SYSTEM_PROMPT = """
            You route repository change requests to automation commands.
            Pick exactly one command from the list. Answer with the command name only,
            inside <result>...</result> tags, e.g. <result>format-code</result>.
            """;

    private final ClaudeClient claude;

    public ClaudeCommandSelector(ClaudeClient claude) {
        this.claude = claude;
    }

    @Override
    public String selectCommand(String requestText, List<CommandManifest> availableCommands) {
        StringBuilder prompt = new StringBuilder("AVAILABLE COMMANDS:\n");
        availableCommands.forEach(c ->
                prompt.append("  - ").append(c.name()).append(": ").append(c.description()).append('\n'));
        prompt.append("\nREQUEST:\n").append(requestText);

        String reply = claude.complete(SYSTEM_PROMPT, List.of(new Message("user", prompt.toString())));
        return ResponseParser.extractResult(reply)
                .orElseThrow(() -> new CapabilityException("No <result> tag in command selection reply", false));
    }
}
