package villagecompute.noos.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response type for {@code GET /api/health}.
 *
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "message": "noos is running",
 *   "entries": 42
 * }
 * }</pre>
 *
 * @param status
 *            always {@code UP} while the server answers
 * @param message
 *            human-readable status line
 * @param entries
 *            number of entries in the timeline store
 */
public record HealthResponseType(@JsonProperty("status") String status, @JsonProperty("message") String message,
        @JsonProperty("entries") int entries) {
}
