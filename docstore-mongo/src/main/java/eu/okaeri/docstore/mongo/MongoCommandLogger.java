package eu.okaeri.docstore.mongo;

import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandStartedEvent;
import com.mongodb.event.CommandSucceededEvent;
import lombok.NonNull;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs driver commands. Started and succeeded commands are logged at {@code FINE},
 * failures at {@code SEVERE}. An empty command name set logs every command.
 */
public class MongoCommandLogger implements CommandListener {

    private static final Logger LOGGER = Logger.getLogger(MongoCommandLogger.class.getSimpleName());

    private final boolean logStarted;
    private final boolean logSucceeded;
    private final boolean logFailed;
    private final Set<String> commandNames;

    public MongoCommandLogger(boolean logStarted, boolean logSucceeded, boolean logFailed, @NonNull Set<String> commandNames) {
        this.logStarted = logStarted;
        this.logSucceeded = logSucceeded;
        this.logFailed = logFailed;
        this.commandNames = Collections.unmodifiableSet(new HashSet<>(commandNames));
    }

    protected boolean isLogged(String commandName) {
        return this.commandNames.isEmpty() || this.commandNames.contains(commandName);
    }

    @Override
    public void commandStarted(CommandStartedEvent event) {
        if (!this.logStarted || !this.isLogged(event.getCommandName()) || !LOGGER.isLoggable(Level.FINE)) {
            return;
        }
        LOGGER.fine("[" + event.getRequestId() + "] " + event.getDatabaseName() + "." + event.getCommandName() + " started: " + event.getCommand().toJson());
    }

    @Override
    public void commandSucceeded(CommandSucceededEvent event) {
        if (!this.logSucceeded || !this.isLogged(event.getCommandName()) || !LOGGER.isLoggable(Level.FINE)) {
            return;
        }
        LOGGER.fine("[" + event.getRequestId() + "] " + event.getCommandName() + " succeeded in " + event.getElapsedTime(TimeUnit.MILLISECONDS) + " ms");
    }

    @Override
    public void commandFailed(CommandFailedEvent event) {
        if (!this.logFailed || !this.isLogged(event.getCommandName())) {
            return;
        }
        LOGGER.log(Level.SEVERE, "[" + event.getRequestId() + "] " + event.getCommandName() + " failed after "
            + event.getElapsedTime(TimeUnit.MILLISECONDS) + " ms", event.getThrowable());
    }
}
