package com.claudeye.core.evals;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Location of the operator's evaluation module ({@code CLAUDEYE_EVALS_MODULE}).
 */
@Component
@ConfigurationProperties(prefix = "claudeye.evals")
public class EvalsProperties {

    private String module = "";

    public String getModule() { return module; }
    public void setModule(String module) { this.module = module; }

    public Optional<Path> modulePath() {
        if (module == null || module.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(module).toAbsolutePath().normalize());
    }
}
