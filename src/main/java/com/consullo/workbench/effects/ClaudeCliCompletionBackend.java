package com.consullo.workbench.effects;

import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.state.ChatMessage;
import com.consullo.workbench.state.ChatRole;
import com.consullo.workbench.state.StateJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completion backend that runs the Claude CLI in print mode and reads its {@code stream-json} output.
 *
 * <p>Each output line is one JSON event:
 * <ul>
 *   <li>{@code content_block_delta} with a {@code text_delta} carries incremental text</li>
 *   <li>{@code assistant} carries a whole message; its text is used when no incremental text was seen</li>
 *   <li>{@code result} ends the stream, as an error when {@code is_error} is set</li>
 * </ul>
 * Other events and lines that are not JSON are skipped.
 *
 * @since 1.0
 */
public final class ClaudeCliCompletionBackend implements CompletionBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClaudeCliCompletionBackend.class);

  private static final String END_OF_STREAM = "\u0000eos";

  private final String executable;
  private final Duration eventTimeout;
  private final ObjectMapper mapper = StateJson.mapper();

  public ClaudeCliCompletionBackend(final String executable, final Duration eventTimeout) {
    Validate.notBlank(executable, "executable must not be blank");
    Validate.isTrue(eventTimeout != null && !eventTimeout.isNegative() && !eventTimeout.isZero(),
        "eventTimeout must be positive");
    this.executable = executable;
    this.eventTimeout = eventTimeout;
  }

  public static ClaudeCliCompletionBackend create(final WorkbenchConfig config) {
    return new ClaudeCliCompletionBackend(config.completionCommand(), config.completionEventTimeout());
  }

  List<String> command(final CompletionRequest request) {
    return List.of(executable, "-p", "--verbose", "--output-format", "stream-json", prompt(request));
  }

  @Override
  public void stream(final CompletionRequest request, final CompletionSink sink)
      throws CompletionFailureException, InterruptedException {
    final Process process;
    try {
      process = new ProcessBuilder(command(request))
          .directory(request.cwd().toFile())
          .redirectError(ProcessBuilder.Redirect.DISCARD)
          .start();
    } catch (final IOException e) {
      throw new CompletionFailureException("Failed to start " + executable + ": " + e.getMessage(), e);
    }

    final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    final Thread reader = new Thread(() -> readLines(process, lines), "claude-cli-" + request.messageId());
    reader.setDaemon(true);
    reader.start();

    try {
      final StreamState stream = new StreamState();
      while (true) {
        final String line = lines.poll(eventTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (line == null) {
          throw new CompletionFailureException("No output from " + executable + " for " + eventTimeout.toSeconds()
              + "s");
        }
        if (END_OF_STREAM.equals(line)) {
          break;
        }
        if (handle(line, sink, stream)) {
          return;
        }
      }
      final int code = process.waitFor();
      if (code != 0) {
        throw new CompletionFailureException(executable + " exited with code " + code);
      }
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  /**
   * Handles one line.
   *
   * @return {@code true} when the line ended the stream successfully
   */
  boolean handle(final String line, final CompletionSink sink, final StreamState stream)
      throws CompletionFailureException {
    if (StringUtils.isBlank(line)) {
      return false;
    }
    final JsonNode event;
    try {
      event = mapper.readTree(line);
    } catch (final JsonProcessingException e) {
      LOGGER.debug("Skipping non-JSON line: {}", StringUtils.abbreviate(line, 120));
      return false;
    }

    switch (event.path("type").asText("")) {
      case "content_block_delta" -> {
        final JsonNode delta = event.path("delta");
        if ("text_delta".equals(delta.path("type").asText()) && delta.hasNonNull("text")) {
          stream.sawDelta = true;
          sink.delta(delta.get("text").asText());
        }
      }
      case "assistant" -> {
        if (!stream.sawDelta) {
          for (final JsonNode item : event.path("message").path("content")) {
            if ("text".equals(item.path("type").asText()) && item.hasNonNull("text")) {
              sink.delta(item.get("text").asText());
            }
          }
        }
      }
      case "result" -> {
        if (event.path("is_error").asBoolean(false)) {
          final String detail = event.path("result").asText(event.path("subtype").asText("error"));
          throw new CompletionFailureException(StringUtils.defaultIfBlank(detail, "completion failed"));
        }
        return true;
      }
      default -> LOGGER.trace("Ignoring {} event", event.path("type").asText());
    }
    return false;
  }

  static String prompt(final CompletionRequest request) {
    if (request.history().isEmpty()) {
      return request.prompt();
    }
    final StringBuilder sb = new StringBuilder(256);
    for (final ChatMessage m : request.history()) {
      if (m.role() == ChatRole.SYSTEM || m.content().isEmpty()) {
        continue;
      }
      sb.append(m.role() == ChatRole.USER ? "User: " : "Assistant: ").append(m.content()).append("\n\n");
    }
    return sb.append("User: ").append(request.prompt()).toString();
  }

  private static void readLines(final Process process, final BlockingQueue<String> lines) {
    try (BufferedReader r = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = r.readLine()) != null) {
        lines.add(line);
      }
    } catch (final IOException e) {
      LOGGER.debug("Completion output closed: {}", e.getMessage());
    } finally {
      lines.add(END_OF_STREAM);
    }
  }

  static final class StreamState {
    private boolean sawDelta;
  }
}
