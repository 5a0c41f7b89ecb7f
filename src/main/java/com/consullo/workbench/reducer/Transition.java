package com.consullo.workbench.reducer;

import com.consullo.workbench.state.AppState;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Result of applying one action: the next state and the effects to run once it is committed.
 *
 * @param state next state, the same instance as the input when nothing changed
 * @param effects effects in execution order
 * @since 1.0
 */
public record Transition(AppState state, List<Effect> effects) {

  public Transition {
    Validate.notNull(state, "state must not be null");
    effects = effects == null ? List.of() : List.copyOf(effects);
  }

  public static Transition unchanged(final AppState state) {
    return new Transition(state, List.of());
  }

  public static Transition of(final AppState state, final Effect... effects) {
    return new Transition(state, List.of(effects));
  }
}
