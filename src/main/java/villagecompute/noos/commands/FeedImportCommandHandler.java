package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.noos.services.ChannelListService;

import java.nio.file.Path;
import java.util.List;

/**
 * Adds every feed of an OPML file to the channel list. Feeds already subscribed are skipped.
 */
@ApplicationScoped
public class FeedImportCommandHandler implements CommandHandler {

    @Inject
    ChannelListService channelListService;

    @Override
    public CommandType handlesType() {
        return CommandType.FEED_IMPORT;
    }

    @Override
    public int execute(List<String> arguments) {
        channelListService.importOpml(Path.of(arguments.get(0)));
        return EXIT_OK;
    }
}
