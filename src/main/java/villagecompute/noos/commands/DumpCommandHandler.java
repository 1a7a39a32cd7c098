package villagecompute.noos.commands;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.services.ChannelListService;
import villagecompute.noos.services.FeedRefreshService;
import villagecompute.noos.services.FeedRefreshService.RefreshSummary;
import villagecompute.noos.services.PageRenderService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Refreshes every subscribed channel, renders the timeline page and writes it to a file.
 *
 * <p>
 * Templates are loaded before any channel is fetched, so a broken template aborts the run immediately. The output
 * path is the optional command argument, falling back to {@code noos.dump.file}. Failing channels are
 * logged and skipped; the page is written with whatever was ingested.
 */
@ApplicationScoped
public class DumpCommandHandler implements CommandHandler {

    private static final Logger LOG = Logger.getLogger(DumpCommandHandler.class);

    @Inject
    ChannelListService channelListService;

    @Inject
    FeedRefreshService feedRefreshService;

    @Inject
    PageRenderService pageRenderService;

    @Inject
    NoosConfig config;

    @Override
    public CommandType handlesType() {
        return CommandType.DUMP;
    }

    @Override
    public int execute(List<String> arguments) throws IOException {
        Path output = arguments.isEmpty() ? config.dumpFile() : Path.of(arguments.get(0));

        pageRenderService.prepareTemplates();
        RefreshSummary summary = feedRefreshService.refreshAll(channelListService.listChannels());
        String html = pageRenderService.renderPage();

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, html, StandardCharsets.UTF_8);

        LOG.infof("Wrote %d chars to %s (%d channel(s) refreshed, %d failed)", html.length(), output,
                summary.succeeded(), summary.failed());
        return EXIT_OK;
    }
}
