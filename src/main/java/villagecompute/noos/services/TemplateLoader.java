package villagecompute.noos.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.exceptions.TemplateLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Supplies raw template text for compilation.
 *
 * <p>
 * <b>Precedence</b> (first match wins, per template):
 * <ol>
 * <li>Explicit path from {@code noos.templates.item-path} / {@code noos.templates.page-path}</li>
 * <li>{@code item.html} / {@code page.html} in the user configuration directory, if present</li>
 * <li>Built-in default from the classpath ({@code default-templates/})</li>
 * </ol>
 *
 * <p>
 * Any source that is selected but cannot be read raises {@link TemplateLoadException}; there is no silent fallback
 * from a broken explicit path to the default.
 */
@ApplicationScoped
public class TemplateLoader {

    private static final Logger LOG = Logger.getLogger(TemplateLoader.class);

    static final String DEFAULT_TEMPLATE_DIR = "default-templates/";

    @Inject
    NoosConfig config;

    /**
     * Template kinds and their file names.
     */
    public enum TemplateKind {
        ITEM("item.html"), PAGE("page.html");

        private final String fileName;

        TemplateKind(String fileName) {
            this.fileName = fileName;
        }

        public String fileName() {
            return fileName;
        }
    }

    public String loadItemTemplate() {
        return load(TemplateKind.ITEM, config.itemTemplatePath());
    }

    public String loadPageTemplate() {
        return load(TemplateKind.PAGE, config.pageTemplatePath());
    }

    /**
     * Loads a template following the precedence rules.
     *
     * @param kind
     *            item or page
     * @param explicitPath
     *            user-specified path, if any
     * @return template text
     * @throws TemplateLoadException
     *             if the selected source cannot be read
     */
    String load(TemplateKind kind, Optional<Path> explicitPath) {
        if (explicitPath.isPresent()) {
            return readFile(kind, explicitPath.get());
        }

        Path userTemplate = config.configDir().resolve(kind.fileName());
        if (Files.isRegularFile(userTemplate)) {
            return readFile(kind, userTemplate);
        }

        return readDefault(kind);
    }

    private String readFile(TemplateKind kind, Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            LOG.infof("Loaded %s template from %s", kind.name().toLowerCase(), path);
            return text;
        } catch (IOException e) {
            LOG.errorf("Failed to read %s template file %s: %s", kind.name().toLowerCase(), path, e.getMessage());
            throw new TemplateLoadException("Failed to read template file: " + path, e);
        }
    }

    private String readDefault(TemplateKind kind) {
        String resource = DEFAULT_TEMPLATE_DIR + kind.fileName();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new TemplateLoadException("Built-in template not found on classpath: " + resource);
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            LOG.infof("Loaded built-in %s template", kind.name().toLowerCase());
            return text;
        } catch (IOException e) {
            throw new TemplateLoadException("Failed to read built-in template: " + resource, e);
        }
    }
}
