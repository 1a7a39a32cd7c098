package villagecompute.noos.commands;

import villagecompute.noos.exceptions.ValidationException;

import java.util.Arrays;
import java.util.List;

/**
 * Enumeration of all noos commands with their command-line spelling and argument count.
 *
 * <p>
 * Each command type is handled by exactly one {@link CommandHandler}. Top-level commands are a single word (with an
 * optional one-letter alias); feed management commands are {@code feed <subcommand>}.
 *
 * @see CommandDispatcher for parsing and routing
 */
public enum CommandType {

    /**
     * Refreshes all channels and writes the rendered page to a file. Default when no command is given.
     */
    DUMP("dump", "d", 0, 1, "dump [file]"),

    /**
     * Refreshes all channels and serves the rendered page over HTTP until shutdown.
     */
    SERVE("serve", "s", 0, 0, "serve"),

    FEED_LIST("feed list", null, 0, 0, "feed list"),

    FEED_ADD("feed add", null, 1, 1, "feed add <url>"),

    FEED_REMOVE("feed remove", null, 1, 1, "feed remove <url>"),

    FEED_IMPORT("feed import", null, 1, 1, "feed import <opml-file>"),

    FEED_EXPORT("feed export", null, 1, 1, "feed export <opml-file>");

    static final String FEED_GROUP = "feed";

    private final String commandName;
    private final String alias;
    private final int minArguments;
    private final int maxArguments;
    private final String usage;

    CommandType(String commandName, String alias, int minArguments, int maxArguments, String usage) {
        this.commandName = commandName;
        this.alias = alias;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
        this.usage = usage;
    }

    public String commandName() {
        return commandName;
    }

    public String usage() {
        return usage;
    }

    /**
     * Parses raw command-line arguments.
     *
     * @param args
     *            arguments as passed to the application
     * @return the selected command and its remaining arguments
     * @throws ValidationException
     *             on an unknown command or a wrong number of arguments
     */
    public static ParsedCommand parse(String... args) {
        List<String> words = Arrays.asList(args);
        if (words.isEmpty()) {
            return new ParsedCommand(DUMP, List.of());
        }

        String first = words.get(0);
        CommandType type;
        List<String> arguments;
        if (FEED_GROUP.equals(first)) {
            if (words.size() < 2) {
                throw new ValidationException("Missing feed subcommand. Usage: " + feedUsage());
            }
            type = byName(FEED_GROUP + " " + words.get(1));
            arguments = words.subList(2, words.size());
        } else {
            type = byName(first);
            arguments = words.subList(1, words.size());
        }

        if (arguments.size() < type.minArguments || arguments.size() > type.maxArguments) {
            throw new ValidationException("Wrong number of arguments. Usage: " + type.usage);
        }
        return new ParsedCommand(type, List.copyOf(arguments));
    }

    private static CommandType byName(String name) {
        for (CommandType type : values()) {
            if (type.commandName.equals(name) || name.equals(type.alias)) {
                return type;
            }
        }
        throw new ValidationException("Unknown command: " + name);
    }

    private static String feedUsage() {
        StringBuilder usage = new StringBuilder();
        for (CommandType type : values()) {
            if (type.commandName.startsWith(FEED_GROUP + " ")) {
                if (usage.length() > 0) {
                    usage.append(" | ");
                }
                usage.append(type.usage);
            }
        }
        return usage.toString();
    }

    /**
     * A parsed command line.
     *
     * @param type
     *            selected command
     * @param arguments
     *            positional arguments after the command words
     */
    public record ParsedCommand(CommandType type, List<String> arguments) {
    }
}
