package io.chronicle.cli;

import io.chronicle.core.model.ToolCall;
import io.chronicle.core.session.OperationContext;
import io.chronicle.core.session.StoredMessage;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Print the message history of a session")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session key")
    String sessionKey;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<StoredMessage> history = context.store().getHistory(OperationContext.background(), sessionKey);
            if (history.isEmpty()) {
                System.out.println("No messages for session '" + sessionKey + "'.");
                return 0;
            }
            for (StoredMessage entry : history) {
                System.out.println(format(entry));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }

    private String format(StoredMessage entry) {
        StringBuilder line = new StringBuilder()
            .append(entry.seq())
            .append(' ')
            .append(entry.role())
            .append(": ")
            .append(entry.content());
        if (entry.message().hasToolCalls()) {
            String calls = entry.message().toolCalls().stream()
                .map(ToolCall::resolvedName)
                .collect(Collectors.joining(", "));
            line.append(" [tool calls: ").append(calls).append(']');
        }
        if (!entry.message().toolCallId().isEmpty()) {
            line.append(" [reply to ").append(entry.message().toolCallId()).append(']');
        }
        return line.toString();
    }
}
