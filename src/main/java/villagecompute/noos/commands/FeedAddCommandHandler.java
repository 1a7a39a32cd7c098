package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.noos.services.ChannelListService;

import java.util.List;

@ApplicationScoped
public class FeedAddCommandHandler implements CommandHandler {

    @Inject
    ChannelListService channelListService;

    @Override
    public CommandType handlesType() {
        return CommandType.FEED_ADD;
    }

    @Override
    public int execute(List<String> arguments) {
        channelListService.addChannel(arguments.get(0));
        return EXIT_OK;
    }
}
