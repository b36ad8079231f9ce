package com.openforge.ariste.config;

import com.openforge.ariste.tool.ToolRegistry;
import com.openforge.ariste.tool.builtin.BashTool;
import com.openforge.ariste.tool.builtin.CalculatorTool;
import com.openforge.ariste.tool.builtin.EditTool;
import com.openforge.ariste.tool.builtin.GlobTool;
import com.openforge.ariste.tool.builtin.GrepTool;
import com.openforge.ariste.tool.builtin.ReadTool;
import com.openforge.ariste.tool.builtin.TodoWriteTool;
import com.openforge.ariste.tool.builtin.WebFetchTool;
import com.openforge.ariste.tool.builtin.WriteTool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.List;

/**
 * The built-in tool set, in the order the model sees it. The delegation
 * tool ("task") is appended by the registry itself.
 */
@Configuration
public class ToolConfig {

    @Bean
    public BashTool bashTool(AgentProperties properties) {
        return new BashTool(workdir(properties));
    }

    @Bean
    public ToolRegistry toolRegistry(AgentProperties properties, HttpClient httpClient, BashTool bashTool) {
        Path workdir = workdir(properties);
        return new ToolRegistry(List.of(
                bashTool,
                new ReadTool(workdir),
                new WriteTool(workdir),
                new GlobTool(workdir),
                new GrepTool(workdir),
                new EditTool(workdir),
                new WebFetchTool(httpClient),
                new TodoWriteTool(),
                new CalculatorTool()
        ));
    }

    private static Path workdir(AgentProperties properties) {
        return Path.of(properties.workingDirectory()).toAbsolutePath().normalize();
    }
}
