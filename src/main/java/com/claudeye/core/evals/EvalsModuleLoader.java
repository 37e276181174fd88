package com.claudeye.core.evals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Applies every {@link EvalsModule} to the {@link EvalRegistry} once.
 * Modules come from Spring beans and, when {@code claudeye.evals.module}
 * names a jar, from that jar's service registrations.
 */
@Component
public class EvalsModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(EvalsModuleLoader.class);

    private final EvalRegistry registry;
    private final EvalsProperties properties;
    private final ObjectProvider<EvalsModule> beanModules;

    private boolean loaded;
    private URLClassLoader moduleClassLoader;

    public EvalsModuleLoader(EvalRegistry registry, EvalsProperties properties,
                             ObjectProvider<EvalsModule> beanModules) {
        this.registry = registry;
        this.properties = properties;
        this.beanModules = beanModules;
    }

    /** Idempotent. Failures are logged and leave whatever was registered so far. */
    public synchronized void ensureLoaded() {
        if (loaded) {
            return;
        }
        loaded = true;

        beanModules.orderedStream().forEach(this::apply);

        properties.modulePath().ifPresent(path -> {
            if (!Files.isRegularFile(path)) {
                log.warn("Evals module {} does not exist", path);
            } else if (!path.getFileName().toString().endsWith(".jar")) {
                log.warn("Evals module {} is not a jar; only jar modules can be loaded", path);
            } else {
                loadJar(path).forEach(this::apply);
            }
        });

        log.info("Evals loaded: {} evals, {} enrichers, {} actions, {} views, {} alerts",
                registry.evals().size(), registry.enrichers().size(), registry.actions().size(),
                registry.registeredViews().size(), registry.alerts().size());
    }

    public synchronized boolean isLoaded() {
        return loaded;
    }

    private List<EvalsModule> loadJar(Path jar) {
        try {
            moduleClassLoader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, getClass().getClassLoader());
            return ServiceLoader.load(EvalsModule.class, moduleClassLoader).stream()
                    .map(ServiceLoader.Provider::get)
                    .toList();
        } catch (IOException | RuntimeException | ServiceConfigurationError e) {
            log.error("Failed to load evals module {}: {}", jar, e.getMessage(), e);
            return List.of();
        }
    }

    private void apply(EvalsModule module) {
        try {
            module.register(registry);
            log.debug("Applied evals module {}", module.getClass().getName());
        } catch (RuntimeException e) {
            log.error("Evals module {} failed to register: {}", module.getClass().getName(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public synchronized void close() {
        if (moduleClassLoader != null) {
            try {
                moduleClassLoader.close();
            } catch (IOException e) {
                log.warn("Failed to close evals module class loader: {}", e.getMessage());
            }
        }
    }
}
