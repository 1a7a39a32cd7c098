package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig.NoosConfigurationException;
import villagecompute.noos.exceptions.DuplicateResourceException;
import villagecompute.noos.exceptions.ResourceNotFoundException;
import villagecompute.noos.exceptions.TemplateLoadException;
import villagecompute.noos.exceptions.ValidationException;
import villagecompute.noos.observability.LoggingConfig;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parses the command line and routes it to the registered {@link CommandHandler}.
 *
 * <p>
 * <b>Exit Status:</b>
 * <ul>
 * <li>{@code 0} - command completed</li>
 * <li>{@code 1} - fatal error (unreadable template, invalid configuration, unexpected failure)</li>
 * <li>{@code 2} - usage error (unknown command, bad arguments, duplicate or missing channel)</li>
 * </ul>
 *
 * <p>
 * Every invocation runs with a fresh {@code run_id} and the command name in the logging MDC.
 *
 * @see CommandHandler for handler contract
 * @see CommandType for supported commands
 */
@ApplicationScoped
public class CommandDispatcher {

    private static final Logger LOG = Logger.getLogger(CommandDispatcher.class);

    /**
     * Registry mapping CommandType → CommandHandler, built once at construction.
     */
    private final Map<CommandType, CommandHandler> handlerRegistry;

    @Inject
    public CommandDispatcher(Instance<CommandHandler> handlers) {
        this((Iterable<CommandHandler>) handlers);
    }

    CommandDispatcher(Iterable<CommandHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.debugf("Initialized CommandDispatcher with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds the type → handler map.
     *
     * @param handlers
     *            all CommandHandler implementations
     * @return EnumMap for O(1) handler lookups
     * @throws IllegalStateException
     *             if two handlers register for the same CommandType
     */
    private Map<CommandType, CommandHandler> buildHandlerRegistry(Iterable<CommandHandler> handlers) {
        Map<CommandType, CommandHandler> registry = new EnumMap<>(CommandType.class);
        for (CommandHandler handler : handlers) {
            CommandType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for CommandType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for CommandType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Parses and executes a command line.
     *
     * @param args
     *            raw application arguments
     * @return process exit status
     */
    public int dispatch(String... args) {
        CommandType.ParsedCommand command;
        try {
            command = CommandType.parse(args);
        } catch (ValidationException e) {
            LOG.error(e.getMessage());
            return CommandHandler.EXIT_USAGE;
        }

        CommandHandler handler = handlerRegistry.get(command.type());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for CommandType." + command.type());
        }

        LoggingConfig.startRun(command.type().commandName());
        try {
            LOG.debugf("Executing command '%s' with arguments %s", command.type().commandName(),
                    command.arguments());
            return handler.execute(command.arguments());

        } catch (ValidationException | DuplicateResourceException | ResourceNotFoundException e) {
            LOG.error(e.getMessage());
            return CommandHandler.EXIT_USAGE;

        } catch (TemplateLoadException | NoosConfigurationException e) {
            LOG.errorf(e, "%s", e.getMessage());
            LOG.error("Exiting...");
            return CommandHandler.EXIT_FAILURE;

        } catch (Exception e) {
            LOG.errorf(e, "Command '%s' failed", command.type().commandName());
            return CommandHandler.EXIT_FAILURE;

        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
