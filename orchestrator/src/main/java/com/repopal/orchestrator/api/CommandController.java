package com.repopal.orchestrator.api;

import com.repopal.orchestrator.api.dto.CommandResponse;
import com.repopal.orchestrator.command.CommandRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /commands: the registered commands and their documentation.
 */
@RestController
@RequestMapping("/commands")
public class CommandController {

    private final CommandRegistry registry;

    public CommandController(CommandRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<CommandResponse> list() {
        return registry.names().stream()
                .map(registry::get)
                .map(CommandResponse::from)
                .toList();
    }
}
