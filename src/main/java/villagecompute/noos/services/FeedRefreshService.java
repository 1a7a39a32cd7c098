package villagecompute.noos.services;

import com.rometools.rome.feed.synd.SyndFeed;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.integration.feeds.FeedFetcher;
import villagecompute.noos.observability.LoggingConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches a set of feeds concurrently and ingests them into the timeline.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Submit one task per feed URL to a pool of {@code noos.fetch.max-concurrency} threads</li>
 * <li>Each task fetches via {@link FeedFetcher} and hands the feed to {@link FeedIngestionService}, whose appends are
 * serialized by the {@link TimelineStore} lock</li>
 * <li>Collect the outcomes in submission order</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> a failing feed (HTTP error, invalid XML, an ingestion failure) is logged with its cause and
 * counted; the remaining feeds are still processed. Pages are ordered by timestamp at render time, so the order in
 * which feeds finish does not matter.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code noos.fetch.duration} (Timer) - Tagged by {@code result={success|failure}}</li>
 * <li>{@code noos.fetch.errors.total} (Counter) - Tagged by {@code error_type}</li>
 * </ul>
 */
@ApplicationScoped
public class FeedRefreshService {

    private static final Logger LOG = Logger.getLogger(FeedRefreshService.class);

    @Inject
    FeedFetcher feedFetcher;

    @Inject
    FeedIngestionService ingestionService;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    NoosConfig config;

    /**
     * Refreshes every given feed.
     *
     * @param feedUrls
     *            feed URLs
     * @return aggregate outcome
     */
    public RefreshSummary refreshAll(List<String> feedUrls) {
        if (feedUrls.isEmpty()) {
            LOG.info("No channels to refresh");
            return new RefreshSummary(0, 0, 0);
        }

        int threads = Math.min(config.fetchMaxConcurrency(), feedUrls.size());
        LOG.infof("Refreshing %d channel(s) with %d worker(s)", feedUrls.size(), threads);

        String runId = LoggingConfig.currentRunId();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Integer>> futures = new ArrayList<>(feedUrls.size());
            for (String feedUrl : feedUrls) {
                futures.add(executor.submit(() -> {
                    LoggingConfig.setRunId(runId);
                    try {
                        return refreshSingleFeed(feedUrl);
                    } finally {
                        LoggingConfig.clearMDC();
                    }
                }));
            }

            int succeeded = 0;
            int failed = 0;
            int entriesAdded = 0;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    entriesAdded += futures.get(i).get();
                    succeeded++;
                } catch (ExecutionException e) {
                    failed++;
                    LOG.errorf(e.getCause(), "Failed to refresh channel %s", feedUrls.get(i));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while refreshing channels", e);
                }
            }

            LOG.infof("Channel refresh completed: %d succeeded, %d failed, %d entries added", succeeded, failed,
                    entriesAdded);
            return new RefreshSummary(succeeded, failed, entriesAdded);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Fetches and ingests one feed.
     *
     * @param feedUrl
     *            feed URL
     * @return number of entries added
     */
    int refreshSingleFeed(String feedUrl) {
        LoggingConfig.setFeedUrl(feedUrl);
        Timer.Sample timerSample = Timer.start(meterRegistry);
        try {
            SyndFeed feed = feedFetcher.fetch(feedUrl);
            int added = ingestionService.ingest(feed, feedUrl).entriesAdded();

            timerSample.stop(Timer.builder("noos.fetch.duration").tag("result", "success").register(meterRegistry));
            return added;
        } catch (RuntimeException e) {
            Counter.builder("noos.fetch.errors.total").tag("error_type", e.getClass().getSimpleName())
                    .register(meterRegistry).increment();
            timerSample.stop(Timer.builder("noos.fetch.duration").tag("result", "failure").register(meterRegistry));
            throw e;
        } finally {
            LoggingConfig.clearFeedUrl();
        }
    }

    /**
     * Outcome of a refresh over several feeds.
     *
     * @param succeeded
     *            feeds fetched and ingested
     * @param failed
     *            feeds that failed
     * @param entriesAdded
     *            total entries appended to the timeline
     */
    public record RefreshSummary(int succeeded, int failed, int entriesAdded) {
    }
}
