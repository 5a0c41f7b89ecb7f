package com.consullo.workbench.session;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.pty.FakePtyProcessController;
import com.consullo.workbench.pty.PtyProcessConfig;
import com.consullo.workbench.support.Await;
import com.consullo.workbench.support.RecordingSink;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class OutputPumpTest {

  private static FakePtyProcessController controller() {
    return new FakePtyProcessController(new PtyProcessConfig(List.of("/bin/sh"), Path.of("/tmp"), null, 80, 24));
  }

  @Test
  @DisplayName("Should coalesce output that is already buffered into one action")
  void run_BufferedChunks_CoalescesIntoOneAction() throws Exception {
    final FakePtyProcessController pty = controller();
    final RecordingSink sink = new RecordingSink();
    pty.emit("hello ");
    pty.emit("world");
    final OutputPump pump = new OutputPump("s-1", pty, sink, 1024, 4);

    pump.start();
    Await.until(() -> sink.size() >= 1, "first output");

    assertThat(sink.actionsOf(Action.TerminalOutput.class))
        .containsExactly(new Action.TerminalOutput("s-1", "hello world"));
    pump.cancel();
  }

  @Test
  @DisplayName("Should never split a multi-byte character across output actions")
  void run_SplitCharacter_EmitsWholeCharacter() throws Exception {
    final FakePtyProcessController pty = controller();
    final RecordingSink sink = new RecordingSink();
    final byte[] bytes = "ü".getBytes(StandardCharsets.UTF_8);
    final OutputPump pump = new OutputPump("s-1", pty, sink, 1024, 4);
    pump.start();

    pty.emit(new byte[] {bytes[0]});
    Thread.sleep(100L);
    assertThat(sink.size()).isZero();
    pty.emit(new byte[] {bytes[1]});
    Await.until(() -> sink.size() == 1, "decoded character");

    assertThat(sink.actionsOf(Action.TerminalOutput.class).get(0).data()).isEqualTo("ü");
    pump.cancel();
  }

  @Test
  @DisplayName("Should stop reading while the in-flight limit is reached")
  void run_InFlightLimitReached_WaitsForStore() throws Exception {
    final FakePtyProcessController pty = controller();
    final RecordingSink sink = new RecordingSink().holdCompletions();
    final OutputPump pump = new OutputPump("s-1", pty, sink, 1024, 2);
    pump.start();

    pty.emit("a");
    Await.until(() -> sink.size() == 1, "first chunk");
    pty.emit("b");
    Await.until(() -> sink.size() == 2, "second chunk");
    pty.emit("c");
    Thread.sleep(200L);

    assertThat(sink.size()).isEqualTo(2);
    assertThat(pump.availablePermits()).isZero();

    sink.completeNext();
    Await.until(() -> sink.size() == 3, "third chunk after a permit was released");
    assertThat(sink.actionsOf(Action.TerminalOutput.class)).extracting(Action.TerminalOutput::data)
        .containsExactly("a", "b", "c");
    pump.cancel();
  }

  @Test
  @DisplayName("Should report the exit code when the process ends")
  void run_ProcessExits_SubmitsTerminalExited() throws Exception {
    final FakePtyProcessController pty = controller();
    final RecordingSink sink = new RecordingSink();
    final OutputPump pump = new OutputPump("s-1", pty, sink, 1024, 4);
    pump.start();

    pty.emit("bye\n");
    pty.exit(3);
    Await.until(() -> !sink.actionsOf(Action.TerminalExited.class).isEmpty(), "exit report");

    final List<Action> actions = sink.actions();
    assertThat(actions).hasSize(2);
    assertThat(actions.get(0)).isEqualTo(new Action.TerminalOutput("s-1", "bye\n"));
    assertThat(actions.get(1)).isEqualTo(new Action.TerminalExited("s-1", 3));
  }

  @Test
  @DisplayName("Should not report an exit after being cancelled")
  void cancel_ThenProcessEnds_SubmitsNothing() throws Exception {
    final FakePtyProcessController pty = controller();
    final RecordingSink sink = new RecordingSink();
    final OutputPump pump = new OutputPump("s-1", pty, sink, 1024, 4);
    pump.start();

    pump.cancel();
    pty.close();
    Thread.sleep(150L);

    assertThat(pump.isCancelled()).isTrue();
    assertThat(sink.actions()).isEmpty();
  }
}
