package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.noos.services.ChannelListService;

import java.nio.file.Path;
import java.util.List;

@ApplicationScoped
public class FeedExportCommandHandler implements CommandHandler {

    @Inject
    ChannelListService channelListService;

    @Override
    public CommandType handlesType() {
        return CommandType.FEED_EXPORT;
    }

    @Override
    public int execute(List<String> arguments) {
        channelListService.exportOpml(Path.of(arguments.get(0)));
        return EXIT_OK;
    }
}
