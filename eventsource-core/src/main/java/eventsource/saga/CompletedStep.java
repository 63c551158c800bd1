package eventsource.saga;

import eventsource.command.Command;

import java.util.Objects;

/**
 * A saga step that has taken effect, with the command that undoes it.
 *
 * @param name         step name, recorded in the compensation log
 * @param compensation command issued during compensation, or {@code null} if the step
 *                     needs no undo
 */
public record CompletedStep(String name, Command compensation) {
  public CompletedStep {
    Objects.requireNonNull(name, "name");
  }
}
