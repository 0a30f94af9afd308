package io.chronicle.cli;

import io.chronicle.core.session.OperationContext;
import io.chronicle.core.session.SessionInfo;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "sessions", description = "List stored sessions, most recently updated first")
public final class SessionsCommand implements Callable<Integer> {
    private final CliContext context;

    public SessionsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<SessionInfo> sessions = context.store().listSessions(OperationContext.background());
            if (sessions.isEmpty()) {
                System.out.println("No sessions stored.");
                return 0;
            }
            for (SessionInfo session : sessions) {
                System.out.println(session.key() + "\t" + session.messageCount() + " message(s)\tupdated " + session.updatedAt());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Sessions command failed: " + e.getMessage());
            return 1;
        }
    }
}
