package villagecompute.noos.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.templates.ItemTemplate;
import villagecompute.noos.templates.PageTemplate;

import java.time.Clock;

/**
 * Renders the timeline page from the shared {@link TimelineStore}.
 *
 * <p>
 * Templates are loaded through {@link TemplateLoader} and compiled once, on first use, then shared by every render
 * (file dump and HTTP requests alike). A template that cannot be read fails that first use with
 * {@link villagecompute.noos.exceptions.TemplateLoadException}.
 *
 * <p>
 * Each render reads a snapshot of the store and the current time from the injected {@link Clock}; render duration is
 * recorded as {@code noos.render.duration}.
 */
@ApplicationScoped
public class PageRenderService {

    private static final Logger LOG = Logger.getLogger(PageRenderService.class);

    @Inject
    TemplateLoader templateLoader;

    @Inject
    TimelineStore timelineStore;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    NoosConfig config;

    @Inject
    Clock clock;

    private volatile CompiledTemplates templates;

    /**
     * Renders the page at the current time.
     *
     * @return page HTML
     */
    public String renderPage() {
        CompiledTemplates compiled = compiledTemplates();
        Timer.Sample sample = Timer.start(meterRegistry);
        String html = compiled.page().render(timelineStore, compiled.item(), clock.instant());
        sample.stop(Timer.builder("noos.render.duration").register(meterRegistry));
        LOG.debugf("Rendered page: %d chars from %d timeline entries", html.length(), timelineStore.size());
        return html;
    }

    /**
     * Loads and compiles both templates now instead of on the first render, so an unreadable template fails a command
     * before any feed is fetched.
     *
     * @throws villagecompute.noos.exceptions.TemplateLoadException
     *             if a template cannot be read
     */
    public void prepareTemplates() {
        compiledTemplates();
    }

    /**
     * Loads and compiles both templates if that has not happened yet.
     *
     * @return the compiled templates
     */
    CompiledTemplates compiledTemplates() {
        CompiledTemplates current = templates;
        if (current == null) {
            synchronized (this) {
                current = templates;
                if (current == null) {
                    LOG.info("Compiling HTML templates");
                    ItemTemplate item = ItemTemplate.compile(templateLoader.loadItemTemplate());
                    PageTemplate page = PageTemplate.compile(templateLoader.loadPageTemplate(), config.zone());
                    current = new CompiledTemplates(item, page);
                    templates = current;
                }
            }
        }
        return current;
    }

    record CompiledTemplates(ItemTemplate item, PageTemplate page) {
    }
}
