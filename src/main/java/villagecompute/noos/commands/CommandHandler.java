package villagecompute.noos.commands;

import java.util.List;

/**
 * Contract for command implementations.
 *
 * <p>Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement
 * this interface. The {@link CommandDispatcher} discovers handlers at startup and routes each
 * invocation based on its {@link CommandType}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * @ApplicationScoped
 * public class FeedListCommandHandler implements CommandHandler {
 *     @Override
 *     public CommandType handlesType() {
 *         return CommandType.FEED_LIST;
 *     }
 *
 *     @Override
 *     public int execute(List<String> arguments) {
 *         channelListService.listChannels().forEach(System.out::println);
 *         return CommandHandler.EXIT_OK;
 *     }
 * }
 * }</pre>
 *
 * @see CommandDispatcher for dispatcher implementation
 * @see CommandType for supported commands
 */
public interface CommandHandler {

    int EXIT_OK = 0;
    int EXIT_FAILURE = 1;
    int EXIT_USAGE = 2;

    /**
     * Returns the command this handler processes.
     *
     * @return the command type enum value
     */
    CommandType handlesType();

    /**
     * Executes the command.
     *
     * <p><b>Error Handling:</b> unchecked domain exceptions propagate to the dispatcher, which
     * logs them and maps them to an exit status.
     *
     * @param arguments positional arguments, already checked against the command's arity
     * @return process exit status
     * @throws Exception any error during execution
     */
    int execute(List<String> arguments) throws Exception;
}
