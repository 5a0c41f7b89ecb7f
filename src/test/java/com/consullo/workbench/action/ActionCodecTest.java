package com.consullo.workbench.action;

import com.consullo.workbench.state.ActiveView;
import com.consullo.workbench.state.FileEntry;
import com.consullo.workbench.state.FileKind;
import com.consullo.workbench.store.InvalidActionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ActionCodecTest {

  private final ActionCodec codec = new ActionCodec();

  @Test
  @DisplayName("Should decode a well formed envelope into its action")
  void decode_ValidEnvelope_ReturnsAction() throws Exception {
    final Action action = codec.decode("{\"type\":\"SpawnTerminal\",\"payload\":{\"worktreeId\":\"wt-1\","
        + "\"cols\":120,\"rows\":40}}");

    assertThat(action).isEqualTo(new Action.SpawnTerminal("wt-1", 120, 40));
    assertThat(action.type()).isEqualTo(ActionType.SPAWN_TERMINAL);
  }

  @Test
  @DisplayName("Should accept a missing payload for actions without fields")
  void decode_NoPayload_DecodesEmptyAction() throws Exception {
    assertThat(codec.decode("{\"type\":\"ClearChat\"}")).isEqualTo(new Action.ClearChat());
    assertThat(codec.decode("{\"type\":\"ClearError\",\"payload\":null}")).isEqualTo(new Action.ClearError());
  }

  @Test
  @DisplayName("Should decode lower-case enum values")
  void decode_EnumField_UsesWireSpelling() throws Exception {
    final Action action = codec.decode("{\"type\":\"SetActiveView\",\"payload\":{\"view\":\"agent_rules\"}}");

    assertThat(action).isEqualTo(new Action.SetActiveView(ActiveView.AGENT_RULES));
  }

  @Test
  @DisplayName("Should ignore unknown payload fields")
  void decode_ExtraField_Ignored() throws Exception {
    final Action action = codec.decode("{\"type\":\"OpenFile\",\"payload\":{\"path\":\"/a\",\"extra\":1}}");

    assertThat(action).isEqualTo(new Action.OpenFile("/a"));
  }

  @Test
  @DisplayName("Should reject an unknown action type")
  void decode_UnknownType_Throws() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"LaunchRocket\",\"payload\":{}}"))
        .isInstanceOf(InvalidActionException.class)
        .hasMessageContaining("LaunchRocket");
  }

  @Test
  @DisplayName("Should reject envelopes that are not objects or lack a type")
  void decode_BadEnvelope_Throws() {
    assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{\"payload\":{}}")).isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{\"type\":7}")).isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{\"type\":\"OpenFile\",\"payload\":\"/a\"}"))
        .isInstanceOf(InvalidActionException.class);
  }

  @Test
  @DisplayName("Should reject relative project and worktree paths")
  void decode_RelativePath_Throws() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"OpenProject\",\"payload\":{\"path\":\"repo\"}}"))
        .isInstanceOf(InvalidActionException.class)
        .hasMessageContaining("absolute");
    assertThatThrownBy(() -> codec.decode(
        "{\"type\":\"AddWorktree\",\"payload\":{\"path\":\"../repo-fix\",\"branch\":\"fix\"}}"))
        .isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> new Action.OpenProject("repo")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should decode env sync actions and reject patterns leaving the worktree")
  void decode_EnvActions_ValidatedPatterns() throws Exception {
    assertThat(codec.decode("{\"type\":\"SetEnvTrackedPatterns\",\"payload\":{\"patterns\":[\".env\",\".vscode/\"]}}"))
        .isEqualTo(new Action.SetEnvTrackedPatterns(List.of(".env", ".vscode/")));
    assertThat(codec.decode("{\"type\":\"SetEnvAutoCopy\",\"payload\":{\"enabled\":false}}"))
        .isEqualTo(new Action.SetEnvAutoCopy(false));
    assertThatThrownBy(() -> codec.decode("{\"type\":\"SetEnvAutoCopy\",\"payload\":{}}"))
        .isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode(
        "{\"type\":\"SetEnvTrackedPatterns\",\"payload\":{\"patterns\":[\"../../.ssh\"]}}"))
        .isInstanceOf(InvalidActionException.class);
  }

  @Test
  @DisplayName("Should reject payloads with missing required fields")
  void decode_MissingField_Throws() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"OpenProject\",\"payload\":{}}"))
        .isInstanceOf(InvalidActionException.class)
        .hasMessageContaining("OpenProject");
    assertThatThrownBy(() -> codec.decode("{\"type\":\"ResizeTerminal\",\"payload\":{\"sessionId\":\"s\","
        + "\"cols\":80}}"))
        .isInstanceOf(InvalidActionException.class);
  }

  @Test
  @DisplayName("Should reject payloads with wrongly typed or out of range fields")
  void decode_BadFieldValues_Throws() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"SpawnTerminal\",\"payload\":{\"worktreeId\":\"wt\","
        + "\"cols\":\"wide\",\"rows\":24}}"))
        .isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{\"type\":\"SpawnTerminal\",\"payload\":{\"worktreeId\":\"wt\","
        + "\"cols\":0,\"rows\":24}}"))
        .isInstanceOf(InvalidActionException.class);
    assertThatThrownBy(() -> codec.decode("{\"type\":\"SetActiveView\",\"payload\":{\"view\":\"nowhere\"}}"))
        .isInstanceOf(InvalidActionException.class);
  }

  @Test
  @DisplayName("Should encode the wire name and payload fields")
  void encodeTree_Action_WritesEnvelope() throws Exception {
    final JsonNode tree = codec.encodeTree(new Action.SetDirectoryCache("wt-1", "/repo",
        List.of(new FileEntry("src", "/repo/src", FileKind.DIRECTORY, 0))));

    assertThat(tree.get("type").asText()).isEqualTo("SetDirectoryCache");
    assertThat(tree.at("/payload/worktreeId").asText()).isEqualTo("wt-1");
    assertThat(tree.at("/payload/entries/0/kind").asText()).isEqualTo("directory");
    assertThat(codec.decode(new ObjectMapper().readTree(codec.encode(new Action.KillTerminal("s-1")))))
        .isEqualTo(new Action.KillTerminal("s-1"));
  }

  @Test
  @DisplayName("Should map every wire name back to its type")
  void fromWireName_AllTypes_RoundTrip() {
    for (final ActionType type : ActionType.values()) {
      assertThat(ActionType.fromWireName(type.wireName())).isSameAs(type);
    }
    assertThat(ActionType.fromWireName("nope")).isNull();
  }
}
