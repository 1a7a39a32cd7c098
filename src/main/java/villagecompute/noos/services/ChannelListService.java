package villagecompute.noos.services;

import com.rometools.opml.feed.opml.Opml;
import com.rometools.opml.feed.opml.Outline;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedInput;
import com.rometools.rome.io.WireFeedOutput;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.exceptions.ChannelListException;
import villagecompute.noos.exceptions.DuplicateResourceException;
import villagecompute.noos.exceptions.ResourceNotFoundException;
import villagecompute.noos.exceptions.ValidationException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Manages the list of subscribed channels (feed URLs).
 *
 * <p>
 * <b>Storage:</b> {@code <noos.config-dir>/channels.txt}, one feed URL per line. Blank lines and lines starting with
 * {@code #} are ignored when reading; the file is rewritten in full on every change. A missing file is an empty list.
 *
 * <p>
 * <b>OPML:</b> import and export use Rome OPML. Import walks the whole outline tree (category folders included) and
 * takes every {@code xmlUrl}; export writes a flat OPML 2.0 document with one {@code rss} outline per channel.
 *
 * <p>
 * Order of the list is preserved; duplicates are rejected on add and skipped on import.
 */
@ApplicationScoped
public class ChannelListService {

    private static final Logger LOG = Logger.getLogger(ChannelListService.class);

    static final String CHANNELS_FILE = "channels.txt";
    static final String OPML_FEED_TYPE = "opml_2.0";

    private static final String FILE_HEADER = "# noos channel list: one RSS/Atom feed URL per line";

    @Inject
    NoosConfig config;

    @Inject
    Clock clock;

    /**
     * @return subscribed feed URLs in file order
     */
    public List<String> listChannels() {
        Path file = channelsFile();
        if (!Files.exists(file)) {
            LOG.debugf("Channel list %s does not exist yet", file);
            return List.of();
        }

        try {
            Set<String> channels = new LinkedHashSet<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    channels.add(trimmed);
                }
            }
            return List.copyOf(channels);
        } catch (IOException e) {
            throw new ChannelListException("Failed to read channel list " + file, e);
        }
    }

    /**
     * Subscribes to a feed.
     *
     * @param feedUrl
     *            http(s) feed URL
     * @throws ValidationException
     *             if the URL is not an absolute http(s) URL
     * @throws DuplicateResourceException
     *             if the URL is already subscribed
     */
    public void addChannel(String feedUrl) {
        String normalized = validateFeedUrl(feedUrl);
        List<String> channels = new ArrayList<>(listChannels());
        if (channels.contains(normalized)) {
            throw new DuplicateResourceException("Channel already subscribed: " + normalized);
        }
        channels.add(normalized);
        writeChannels(channels);
        LOG.infof("Added channel %s", normalized);
    }

    /**
     * Unsubscribes from a feed.
     *
     * @param feedUrl
     *            subscribed feed URL
     * @throws ResourceNotFoundException
     *             if the URL is not subscribed
     */
    public void removeChannel(String feedUrl) {
        String normalized = feedUrl == null ? "" : feedUrl.trim();
        List<String> channels = new ArrayList<>(listChannels());
        if (!channels.remove(normalized)) {
            throw new ResourceNotFoundException("Channel not subscribed: " + normalized);
        }
        writeChannels(channels);
        LOG.infof("Removed channel %s", normalized);
    }

    /**
     * Imports every feed URL found in an OPML document.
     *
     * @param opmlFile
     *            OPML file
     * @return number of channels added
     * @throws ChannelListException
     *             if the file cannot be read or is not OPML
     */
    public int importOpml(Path opmlFile) {
        Opml opml;
        try (Reader reader = Files.newBufferedReader(opmlFile, StandardCharsets.UTF_8)) {
            WireFeed wireFeed = new WireFeedInput().build(reader);
            if (!(wireFeed instanceof Opml)) {
                throw new ChannelListException("Not an OPML document: " + opmlFile);
            }
            opml = (Opml) wireFeed;
        } catch (IOException | FeedException | IllegalArgumentException e) {
            throw new ChannelListException("Failed to read OPML file " + opmlFile + ": " + e.getMessage(), e);
        }

        List<String> found = new ArrayList<>();
        collectFeedUrls(opml.getOutlines(), found);

        List<String> channels = new ArrayList<>(listChannels());
        int added = 0;
        int skipped = 0;
        for (String url : found) {
            String normalized;
            try {
                normalized = validateFeedUrl(url);
            } catch (ValidationException e) {
                LOG.warnf("Skipping OPML outline with invalid feed URL: %s", url);
                skipped++;
                continue;
            }
            if (channels.contains(normalized)) {
                skipped++;
                continue;
            }
            channels.add(normalized);
            added++;
        }

        if (added > 0) {
            writeChannels(channels);
        }
        LOG.infof("Imported %d channel(s) from %s (%d skipped)", added, opmlFile, skipped);
        return added;
    }

    /**
     * Exports the channel list as OPML 2.0.
     *
     * @param opmlFile
     *            destination file, overwritten if it exists
     * @return number of channels exported
     */
    public int exportOpml(Path opmlFile) {
        List<String> channels = listChannels();

        List<Outline> outlines = new ArrayList<>(channels.size());
        for (String url : channels) {
            try {
                Outline outline = new Outline(url, URI.create(url).toURL(), null);
                outline.setText(url);
                outlines.add(outline);
            } catch (MalformedURLException | IllegalArgumentException e) {
                LOG.warnf("Skipping channel with invalid URL during export: %s", url);
            }
        }

        Opml opml = new Opml();
        opml.setFeedType(OPML_FEED_TYPE);
        opml.setTitle("noos channels");
        opml.setCreated(Date.from(clock.instant()));
        opml.setOutlines(outlines);

        try {
            createParentDirectories(opmlFile);
            try (Writer writer = Files.newBufferedWriter(opmlFile, StandardCharsets.UTF_8)) {
                new WireFeedOutput().output(opml, writer);
            }
        } catch (IOException | FeedException e) {
            throw new ChannelListException("Failed to write OPML file " + opmlFile + ": " + e.getMessage(), e);
        }

        LOG.infof("Exported %d channel(s) to %s", outlines.size(), opmlFile);
        return outlines.size();
    }

    /**
     * Validates and normalizes a feed URL.
     *
     * @param feedUrl
     *            candidate URL
     * @return trimmed URL
     * @throws ValidationException
     *             if the URL is not an absolute http(s) URL with a host
     */
    static String validateFeedUrl(String feedUrl) {
        if (feedUrl == null || feedUrl.isBlank()) {
            throw new ValidationException("Feed URL must not be empty");
        }
        String trimmed = feedUrl.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ValidationException("Feed URL must use http or https: " + trimmed);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ValidationException("Feed URL has no host: " + trimmed);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Malformed feed URL: " + trimmed, e);
        }
        return trimmed;
    }

    Path channelsFile() {
        return config.configDir().resolve(CHANNELS_FILE);
    }

    private void collectFeedUrls(List<Outline> outlines, List<String> found) {
        if (outlines == null) {
            return;
        }
        for (Outline outline : outlines) {
            String xmlUrl = outline.getXmlUrl();
            if (xmlUrl != null && !xmlUrl.isBlank()) {
                found.add(xmlUrl.trim());
            }
            collectFeedUrls(outline.getChildren(), found);
        }
    }

    private void writeChannels(List<String> channels) {
        Path file = channelsFile();
        List<String> lines = new ArrayList<>(channels.size() + 1);
        lines.add(FILE_HEADER);
        lines.addAll(channels);
        try {
            createParentDirectories(file);
            Files.write(file, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ChannelListException("Failed to write channel list " + file, e);
        }
    }

    private void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
