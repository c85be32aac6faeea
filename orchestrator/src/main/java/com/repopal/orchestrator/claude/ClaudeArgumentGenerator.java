package com.repopal.orchestrator.claude;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repopal.orchestrator.capability.ArgumentGenerator;
import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.capability.GeneratedArguments;
import com.repopal.orchestrator.claude.ClaudeClient.Message;
import com.repopal.orchestrator.command.CommandManifest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks Claude to fill in a command's arguments as JSON.
 * A command without arguments needs no call at all.
 */
@Component
public class ClaudeArgumentGenerator implements ArgumentGenerator {

    static final String SYSTEM_PROMPT = """
            You extract command arguments from repository change requests.
            Reply with a JSON object {"required": {...}, "optional": {...}} of string values,
            inside <result>...</result> tags. Omit optional arguments the request does not mention.
            """;

    private final ClaudeClient claude;
    private final ObjectMapper objectMapper;

    public ClaudeArgumentGenerator(ClaudeClient claude, ObjectMapper objectMapper) {
        this.claude       = claude;
        this.objectMapper = objectMapper;
    }

    @Override
    public GeneratedArguments generateArguments(CommandManifest command, String requestText,
                                                List<String> referencedFiles, List<String> referencedBranches) {
        if (command.requiredArgs().isEmpty() && command.optionalArgs().isEmpty()) {
            return GeneratedArguments.none();
        }

        String prompt = """
                COMMAND: %s
                REQUIRED ARGUMENTS: %s
                OPTIONAL ARGUMENTS: %s
                REFERENCED FILES: %s
                REFERENCED BRANCHES: %s

                REQUEST:
                %s
                """.formatted(command.name(), command.requiredArgs(), command.optionalArgs(),
                referencedFiles, referencedBranches, requestText);

        String reply = claude.complete(SYSTEM_PROMPT, List.of(new Message("user", prompt)));
        String jsonText = ResponseParser.extractJson(reply)
                .orElseThrow(() -> new CapabilityException("No arguments JSON in reply", false));
        try {
            return objectMapper.readValue(jsonText, GeneratedArguments.class);
        } catch (JsonProcessingException e) {
            throw new CapabilityException("Arguments reply is not valid JSON: " + e.getOriginalMessage(), false, e);
        }
    }
}
