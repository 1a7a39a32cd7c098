package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.services.ChannelListService;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the subscribed feed URLs, one per line, to standard output.
 */
@ApplicationScoped
public class FeedListCommandHandler implements CommandHandler {

    private static final Logger LOG = Logger.getLogger(FeedListCommandHandler.class);

    @Inject
    ChannelListService channelListService;

    PrintStream out = System.out;

    @Override
    public CommandType handlesType() {
        return CommandType.FEED_LIST;
    }

    @Override
    public int execute(List<String> arguments) {
        List<String> channels = channelListService.listChannels();
        if (channels.isEmpty()) {
            LOG.info("No channels subscribed. Add one with: feed add <url>");
            return EXIT_OK;
        }
        channels.forEach(out::println);
        return EXIT_OK;
    }
}
