package villagecompute.noos.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.noos.services.PageRenderService;

@Path("/")
@Tag(
        name = "Timeline",
        description = "Rendered timeline page")
public class TimelineResource {

    static final String TEXT_HTML_UTF8 = MediaType.TEXT_HTML + ";charset=UTF-8";

    @Inject
    PageRenderService pageRenderService;

    @GET
    @Produces(TEXT_HTML_UTF8)
    @Operation(
            summary = "Timeline page",
            description = "Render the timeline of all ingested entries, newest first")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Rendered page",
                    content = @Content(
                            mediaType = MediaType.TEXT_HTML)),
                    @APIResponse(
                            responseCode = "500",
                            description = "Template could not be loaded")})
    public String timeline() {
        return pageRenderService.renderPage();
    }
}
