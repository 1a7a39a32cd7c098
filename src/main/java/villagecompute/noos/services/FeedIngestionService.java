package villagecompute.noos.services;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.data.models.TimelineEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Turns parsed feeds into {@link TimelineEntry} values and appends them to the {@link TimelineStore}.
 *
 * <p>
 * <b>Field Extraction:</b> title, description and link are taken from the Rome entry as-is. A {@code null} field is
 * "absent" and gets its display default in {@link TimelineEntry}; an empty field stays empty. The source name and
 * link come from the channel, with the feed URL standing in for a channel that declares no link.
 *
 * <p>
 * <b>Timestamp Fallback Policy:</b> the entry timestamp is its published date, else its updated date. An entry with
 * neither is timestamped {@link #FALLBACK_OFFSET} before ingestion time and rendered with empty date/time strings.
 * Fallbacks are counted and reported in one warning per ingested feed, not per entry.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code noos.ingest.entries.total} (Counter) - Entries appended to the timeline</li>
 * <li>{@code noos.ingest.timestamp_fallback.total} (Counter) - Entries that needed a fallback timestamp</li>
 * </ul>
 */
@ApplicationScoped
public class FeedIngestionService {

    private static final Logger LOG = Logger.getLogger(FeedIngestionService.class);

    /**
     * How far before ingestion time an undated entry is placed.
     */
    public static final Duration FALLBACK_OFFSET = Duration.ofMinutes(1);

    @Inject
    TimelineStore timelineStore;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    NoosConfig config;

    @Inject
    Clock clock;

    /**
     * Converts every entry of a feed and appends the batch to the timeline.
     *
     * @param feed
     *            parsed feed
     * @param feedUrl
     *            URL the feed was fetched from
     * @return counts for the batch
     */
    public IngestionResult ingest(SyndFeed feed, String feedUrl) {
        List<TimelineEntry> batch = toEntries(feed, feedUrl);
        timelineStore.appendAll(batch);

        long fallbacks = batch.stream().filter(entry -> entry.publishedAt() == null).count();

        Counter.builder("noos.ingest.entries.total").register(meterRegistry).increment(batch.size());
        if (fallbacks > 0) {
            Counter.builder("noos.ingest.timestamp_fallback.total").register(meterRegistry).increment(fallbacks);
            LOG.warnf("%d of %d entries from %s had no usable publish date; timestamped %d seconds before ingestion",
                    fallbacks, batch.size(), feedUrl, FALLBACK_OFFSET.toSeconds());
        }

        LOG.infof("Ingested %d entries from %s (%s)", batch.size(), sourceName(feed), feedUrl);
        return new IngestionResult(batch.size(), (int) fallbacks);
    }

    /**
     * Converts the entries of a feed without touching the store.
     *
     * @param feed
     *            parsed feed
     * @param feedUrl
     *            URL the feed was fetched from
     * @return timeline entries in feed order
     */
    public List<TimelineEntry> toEntries(SyndFeed feed, String feedUrl) {
        ZoneId zone = config.zone();
        long fallbackTimestamp = clock.instant().minus(FALLBACK_OFFSET).getEpochSecond();

        String sourceName = feed.getTitle();
        String sourceLink = feed.getLink() != null && !feed.getLink().isBlank() ? feed.getLink() : feedUrl;

        List<TimelineEntry> entries = new ArrayList<>(feed.getEntries().size());
        for (SyndEntry syndEntry : feed.getEntries()) {
            String title = syndEntry.getTitle();
            String description = extractDescription(syndEntry);
            String link = syndEntry.getLink();
            Date publishedDate = extractPublishedDate(syndEntry);

            if (publishedDate != null) {
                entries.add(TimelineEntry.published(title, description, sourceName, sourceLink, link,
                        publishedDate.toInstant().atZone(zone)));
            } else {
                LOG.debugf("No publish date for entry '%s' from %s, using fallback timestamp",
                        title != null ? title : TimelineEntry.NO_TITLE, feedUrl);
                entries.add(TimelineEntry.undated(title, description, sourceName, sourceLink, link,
                        fallbackTimestamp));
            }
        }
        return entries;
    }

    private String extractDescription(SyndEntry entry) {
        if (entry.getDescription() != null) {
            return entry.getDescription().getValue();
        }
        return null;
    }

    private Date extractPublishedDate(SyndEntry entry) {
        if (entry.getPublishedDate() != null) {
            return entry.getPublishedDate();
        }
        return entry.getUpdatedDate();
    }

    private String sourceName(SyndFeed feed) {
        return feed.getTitle() != null ? feed.getTitle() : TimelineEntry.NO_SOURCE;
    }

    /**
     * Outcome of ingesting one feed.
     *
     * @param entriesAdded
     *            entries appended to the timeline
     * @param fallbackTimestamps
     *            entries among them that received a fallback timestamp
     */
    public record IngestionResult(int entriesAdded, int fallbackTimestamps) {
    }
}
