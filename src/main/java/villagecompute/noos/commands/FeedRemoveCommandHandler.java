package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.noos.services.ChannelListService;

import java.util.List;

@ApplicationScoped
public class FeedRemoveCommandHandler implements CommandHandler {

    @Inject
    ChannelListService channelListService;

    @Override
    public CommandType handlesType() {
        return CommandType.FEED_REMOVE;
    }

    @Override
    public int execute(List<String> arguments) {
        channelListService.removeChannel(arguments.get(0));
        return EXIT_OK;
    }
}
