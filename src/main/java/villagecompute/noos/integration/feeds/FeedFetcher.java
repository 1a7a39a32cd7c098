package villagecompute.noos.integration.feeds;

import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.exceptions.FeedFetchException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for RSS/Atom feeds.
 *
 * <p>
 * Fetches feed XML with {@link HttpClient} (5-second connect timeout, redirects followed, per-request timeout from
 * {@code noos.fetch.timeout-seconds}) and parses it with Rome {@link SyndFeedInput}. Rome handles RSS 0.9x/1.0/2.0 and
 * Atom and normalizes publish dates; an entry whose date Rome cannot parse comes back with a {@code null} date and is
 * handled by the ingestion fallback policy.
 *
 * <p>
 * <b>Error Handling:</b> Non-200 responses, network failures and invalid XML are all reported as
 * {@link FeedFetchException}. Callers decide whether one failing feed aborts anything; feed refresh does not.
 *
 * @see villagecompute.noos.services.FeedIngestionService for turning feed entries into timeline entries
 */
@ApplicationScoped
public class FeedFetcher {

    private static final Logger LOG = Logger.getLogger(FeedFetcher.class);

    static final String USER_AGENT = "noos/1.0";

    @Inject
    NoosConfig config;

    private final HttpClient httpClient;

    public FeedFetcher() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Fetches and parses a feed.
     *
     * @param feedUrl
     *            RSS/Atom feed URL
     * @return the parsed feed
     * @throws FeedFetchException
     *             on HTTP error status, network failure or unparsable content
     */
    public SyndFeed fetch(String feedUrl) {
        LOG.debugf("Fetching feed: url=%s", feedUrl);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(feedUrl)).timeout(config.fetchTimeout())
                    .header("User-Agent", USER_AGENT).GET().build();
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException("Invalid feed URL: " + feedUrl, e);
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new FeedFetchException("GET request failed for " + feedUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException("Interrupted while fetching " + feedUrl, e);
        }

        if (response.statusCode() != 200) {
            closeQuietly(response.body(), feedUrl);
            throw new FeedFetchException(String.format("HTTP %d: %s", response.statusCode(), feedUrl));
        }

        try (InputStream body = response.body()) {
            return parse(body, feedUrl);
        } catch (IOException e) {
            throw new FeedFetchException("Failed to read response body from " + feedUrl, e);
        }
    }

    /**
     * Parses feed XML that has already been obtained.
     *
     * @param xml
     *            feed document
     * @param feedUrl
     *            where the document came from, for diagnostics
     * @return the parsed feed
     * @throws FeedFetchException
     *             if the document is not a valid RSS/Atom feed
     */
    public SyndFeed parse(InputStream xml, String feedUrl) {
        try {
            SyndFeed feed = new SyndFeedInput().build(new XmlReader(xml));
            LOG.debugf("Parsed %d entries from feed %s", feed.getEntries().size(), feedUrl);
            return feed;
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedFetchException("Failed to parse feed " + feedUrl + ": " + e.getMessage(), e);
        }
    }

    private void closeQuietly(InputStream body, String feedUrl) {
        try {
            body.close();
        } catch (IOException e) {
            LOG.debugf("Failed to close response body for %s: %s", feedUrl, e.getMessage());
        }
    }
}
