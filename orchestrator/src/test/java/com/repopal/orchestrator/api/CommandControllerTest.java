package com.repopal.orchestrator.api;

import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.command.ContainerCommand;
import com.repopal.orchestrator.config.RepoPalProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CommandController.class)
class CommandControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean CommandRegistry registry;

    @Test
    void list_returnsCommandsWithTheirContract() throws Exception {
        RepoPalProperties.CommandDefinition def = new RepoPalProperties.CommandDefinition();
        def.setImage("ghcr.io/repopal/license:1");
        def.setDescription("Add a license header");
        def.setRequiredArgs(List.of("license"));
        when(registry.names()).thenReturn(List.of("add-license-header"));
        when(registry.get("add-license-header")).thenReturn(new ContainerCommand("add-license-header", def));

        mockMvc.perform(get("/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("add-license-header"))
                .andExpect(jsonPath("$[0].requiredArgs[0]").value("license"))
                .andExpect(jsonPath("$[0].writeAllowed").value(true))
                .andExpect(jsonPath("$[0].networkAllowed").value(false))
                .andExpect(jsonPath("$[0].documentation").value("add-license-header: Add a license header Required: license."));
    }
}
