package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Main content view selected across all projects.
 */
public enum ActiveView {
  @JsonProperty("workflows") WORKFLOWS,
  @JsonProperty("tasks") TASKS,
  @JsonProperty("settings") SETTINGS,
  @JsonProperty("dockers") DOCKERS,
  @JsonProperty("env") ENV,
  @JsonProperty("agent_rules") AGENT_RULES,
  @JsonProperty("mcp") MCP,
  @JsonProperty("chat") CHAT,
  @JsonProperty("terminal") TERMINAL,
  @JsonProperty("explorer") EXPLORER
}
