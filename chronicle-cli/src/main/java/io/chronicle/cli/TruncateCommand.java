package io.chronicle.cli;

import io.chronicle.core.session.OperationContext;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "truncate", description = "Drop all but the most recent messages of a session")
public final class TruncateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session key")
    String sessionKey;

    @Option(names = {"-k", "--keep"}, required = true, description = "Number of most recent messages to keep; 0 clears the history")
    int keepLast;

    public TruncateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.store().truncateHistory(OperationContext.background(), sessionKey, keepLast);
            int remaining = context.store().getHistory(OperationContext.background(), sessionKey).size();
            System.out.println("Session '" + sessionKey + "' now holds " + remaining + " message(s).");
            return 0;
        } catch (Exception e) {
            System.err.println("Truncate command failed: " + e.getMessage());
            return 1;
        }
    }
}
