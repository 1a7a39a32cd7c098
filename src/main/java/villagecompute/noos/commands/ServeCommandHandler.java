package villagecompute.noos.commands;

import io.quarkus.runtime.Quarkus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.noos.services.ChannelListService;
import villagecompute.noos.services.FeedRefreshService;
import villagecompute.noos.services.PageRenderService;

import java.util.List;

/**
 * Refreshes every subscribed channel once, then keeps the HTTP server up until the process is asked to stop.
 *
 * <p>
 * The page itself is served by {@link villagecompute.noos.api.rest.TimelineResource}; each request renders the
 * current timeline.
 */
@ApplicationScoped
public class ServeCommandHandler implements CommandHandler {

    private static final Logger LOG = Logger.getLogger(ServeCommandHandler.class);

    @Inject
    ChannelListService channelListService;

    @Inject
    FeedRefreshService feedRefreshService;

    @Inject
    PageRenderService pageRenderService;

    @ConfigProperty(
            name = "quarkus.http.host",
            defaultValue = "127.0.0.1")
    String httpHost;

    @ConfigProperty(
            name = "quarkus.http.port",
            defaultValue = "9005")
    int httpPort;

    @Override
    public CommandType handlesType() {
        return CommandType.SERVE;
    }

    @Override
    public int execute(List<String> arguments) {
        pageRenderService.prepareTemplates();
        feedRefreshService.refreshAll(channelListService.listChannels());
        LOG.infof("Serving timeline at http://%s:%d/", httpHost, httpPort);
        waitForShutdown();
        return EXIT_OK;
    }

    void waitForShutdown() {
        Quarkus.waitForExit();
    }
}
