package villagecompute.noos.observability;

import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Structured logging context for noos runs.
 *
 * <p>
 * Defines the MDC field names included in the console log format (see {@code quarkus.log.console.format} in
 * {@code application.properties}) and helpers to set and clear them.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code run_id} - Random identifier of one command invocation, shared by all of its log lines</li>
 * <li>{@code command} - Command being executed (e.g., {@code dump}, {@code feed add})</li>
 * <li>{@code feed_url} - Feed currently being fetched or ingested</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Command Handlers:</b>
 *
 * <pre>
 * LoggingConfig.startRun("dump");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Feed refresh workers set
 * and clear {@code feed_url} on their own threads.
 */
public final class LoggingConfig {

    /**
     * Identifier of one command invocation (UUID string).
     */
    public static final String MDC_RUN_ID = "run_id";

    /**
     * Command name as typed on the command line (e.g., "dump", "feed import").
     */
    public static final String MDC_COMMAND = "command";

    /**
     * URL of the feed being processed. Only present on fetch and ingestion log lines.
     */
    public static final String MDC_FEED_URL = "feed_url";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Starts a new run: assigns a fresh run id and records the command.
     *
     * @param command
     *            command name
     * @return the generated run id
     */
    public static String startRun(String command) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        setCommand(command);
        return runId;
    }

    /**
     * Sets the run id, e.g. to propagate it to a worker thread.
     *
     * @param runId
     *            run identifier
     */
    public static void setRunId(String runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId);
        }
    }

    /**
     * @return the current run id, or {@code null} outside a run
     */
    public static String currentRunId() {
        Object runId = MDC.get(MDC_RUN_ID);
        return runId == null ? null : runId.toString();
    }

    public static void setCommand(String command) {
        if (command != null) {
            MDC.put(MDC_COMMAND, command);
        }
    }

    public static void setFeedUrl(String feedUrl) {
        if (feedUrl != null) {
            MDC.put(MDC_FEED_URL, feedUrl);
        }
    }

    public static void clearFeedUrl() {
        MDC.remove(MDC_FEED_URL);
    }

    /**
     * Clears all noos MDC fields. Call at the end of every command and worker task.
     */
    public static void clearMDC() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_COMMAND);
        MDC.remove(MDC_FEED_URL);
    }
}
