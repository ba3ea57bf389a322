package com.codeflow.core.frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of {@link LanguageFrontend}s by id or file extension.
 *
 * <p>The default registry is populated once via {@link ServiceLoader}; tests and embedders
 * may build a registry from an explicit list instead.
 *
 * <pre>{@code
 * FrontendRegistry registry = FrontendRegistry.load();
 * LanguageFrontend frontend = registry.require(LanguageDetector.detect(source));
 * String diagram = frontend.renderFlowchart(source);
 * }</pre>
 */
public final class FrontendRegistry {

    private static final Logger log = LoggerFactory.getLogger(FrontendRegistry.class);

    private final Map<String, LanguageFrontend> frontends;

    public FrontendRegistry(Collection<? extends LanguageFrontend> frontends) {
        Objects.requireNonNull(frontends, "frontends must not be null");
        Map<String, LanguageFrontend> byId = new LinkedHashMap<>();
        for (LanguageFrontend frontend : frontends) {
            LanguageFrontend previous = byId.putIfAbsent(frontend.getId(), frontend);
            if (previous != null) {
                log.warn("Duplicate front end id '{}': keeping {}, ignoring {}", frontend.getId(),
                    previous.getClass().getName(), frontend.getClass().getName());
            }
        }
        this.frontends = Collections.unmodifiableMap(byId);
    }

    /**
     * Discovers front ends via {@link ServiceLoader}.
     *
     * @return registry of all front ends on the class path
     */
    public static FrontendRegistry load() {
        log.debug("Discovering language front ends via ServiceLoader");
        List<LanguageFrontend> found = new ArrayList<>();
        ServiceLoader.load(LanguageFrontend.class).forEach(found::add);
        log.debug("Found {} front ends", found.size());
        return new FrontendRegistry(found);
    }

    public Optional<LanguageFrontend> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(frontends.get(id.strip().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the front end with the given id.
     *
     * @param id front-end id
     * @return front end
     * @throws IllegalArgumentException if no front end has that id
     */
    public LanguageFrontend require(String id) {
        return get(id).orElseThrow(() ->
            new IllegalArgumentException("Unknown language: " + id + " (available: " + frontends.keySet() + ")"));
    }

    /**
     * Finds the front end responsible for a file by its extension.
     *
     * @param file source file
     * @return matching front end, or empty
     */
    public Optional<LanguageFrontend> forFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return frontends.values().stream()
            .filter(frontend -> frontend.getFileExtensions().contains(extension))
            .findFirst();
    }

    public Collection<LanguageFrontend> all() {
        return frontends.values();
    }
}
