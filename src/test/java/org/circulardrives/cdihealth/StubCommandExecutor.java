package org.circulardrives.cdihealth;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.circulardrives.cdihealth.application.port.CommandExecutionException;
import org.circulardrives.cdihealth.application.port.CommandExecutor;
import org.circulardrives.cdihealth.domain.command.CommandResult;
import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;

/**
 * Replays canned results keyed by the last command-line argument (the device path, or {@code --json} for a scan).
 */
public final class StubCommandExecutor implements CommandExecutor {
  private final Map<String, Reply> replies = new ConcurrentHashMap<>();
  private final List<DiagnosticCommand> executed = new CopyOnWriteArrayList<>();

  public StubCommandExecutor scanReturns(String json) {
    return reply("--json", CommandResult.ofText(0, json));
  }

  public StubCommandExecutor deviceReturns(String path, String json) {
    return reply(path, CommandResult.ofText(0, json));
  }

  public StubCommandExecutor reply(String lastArgument, CommandResult result) {
    replies.put(lastArgument, command -> result);
    return this;
  }

  public StubCommandExecutor reply(String lastArgument, Reply reply) {
    replies.put(lastArgument, reply);
    return this;
  }

  public List<DiagnosticCommand> executed() {
    return executed;
  }

  @Override
  public CommandResult execute(DiagnosticCommand command) throws CommandExecutionException, InterruptedException {
    executed.add(command);
    List<String> line = command.commandLine();
    Reply reply = replies.get(line.get(line.size() - 1));
    if (reply == null) {
      throw new CommandExecutionException("no canned reply for " + command);
    }
    return reply.apply(command);
  }

  /** Canned behaviour for one command. */
  @FunctionalInterface
  public interface Reply {
    CommandResult apply(DiagnosticCommand command) throws CommandExecutionException, InterruptedException;
  }
}
