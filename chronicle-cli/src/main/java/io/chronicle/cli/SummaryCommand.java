package io.chronicle.cli;

import io.chronicle.core.session.OperationContext;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "summary", description = "Print or replace the summary of a session")
public final class SummaryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session key")
    String sessionKey;

    @Option(names = "--set", description = "Replace the summary with this text")
    String replacement;

    public SummaryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (replacement != null) {
                context.store().setSummary(OperationContext.background(), sessionKey, replacement);
                System.out.println("Summary updated for session '" + sessionKey + "'.");
                return 0;
            }
            System.out.println(context.store().getSummary(OperationContext.background(), sessionKey));
            return 0;
        } catch (Exception e) {
            System.err.println("Summary command failed: " + e.getMessage());
            return 1;
        }
    }
}
