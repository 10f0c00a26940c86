package org.dxworks.mesonactions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class CodeActionsConfig {
    private static final Logger LOG = LoggerFactory.getLogger(CodeActionsConfig.class);

    private static final String CONFIG_FILE_NAME = "mesonactions-config.yml";
    private static final String DEFAULT_DEPENDENCY_SUFFIX = "_dep";
    private static final boolean DEFAULT_COPY_FILE_INSTALL = false;

    private final Set<String> disabledActions;
    private final String dependencySuffix;
    private final boolean copyFileInstallDefault;
    private final Map<String, String> functionAliases;

    private CodeActionsConfig(Set<String> disabledActions, String dependencySuffix,
                              boolean copyFileInstallDefault, Map<String, String> functionAliases) {
        this.disabledActions = Collections.unmodifiableSet(new HashSet<>(disabledActions));
        this.dependencySuffix = dependencySuffix;
        this.copyFileInstallDefault = copyFileInstallDefault;
        this.functionAliases = Collections.unmodifiableMap(new HashMap<>(functionAliases));
    }

    public boolean isActionEnabled(String name) {
        return !disabledActions.contains(name);
    }

    public Set<String> getDisabledActions() {
        return disabledActions;
    }

    /** Appended to a library variable to name its dependency object. */
    public String getDependencySuffix() {
        return dependencySuffix;
    }

    /** Value written for a missing {@code install} keyword of {@code copy_file}. */
    public boolean getCopyFileInstallDefault() {
        return copyFileInstallDefault;
    }

    public Map<String, String> getFunctionAliases() {
        return functionAliases;
    }

    public static CodeActionsConfig defaults() {
        return new CodeActionsConfig(Set.of(), DEFAULT_DEPENDENCY_SUFFIX, DEFAULT_COPY_FILE_INSTALL, Map.of());
    }

    public static CodeActionsConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodeActionsConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Set<String> disabled = yamlConfig.disabledActions != null
                        ? new HashSet<>(yamlConfig.disabledActions)
                        : Set.of();
                String suffix = isValidSuffix(yamlConfig.dependencySuffix)
                        ? yamlConfig.dependencySuffix
                        : DEFAULT_DEPENDENCY_SUFFIX;
                boolean install = yamlConfig.copyFileInstallDefault != null
                        ? yamlConfig.copyFileInstallDefault
                        : DEFAULT_COPY_FILE_INSTALL;
                Map<String, String> aliases = new HashMap<>();
                if (yamlConfig.functionAliases != null) {
                    yamlConfig.functionAliases.forEach((alias, target) -> {
                        if (alias != null && target != null) {
                            aliases.put(alias, target);
                        }
                    });
                }

                return new CodeActionsConfig(disabled, suffix, install, aliases);
            }
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CodeActionsConfig with(Set<String> disabledActions, String dependencySuffix,
                                         boolean copyFileInstallDefault, Map<String, String> functionAliases) {
        String effectiveSuffix = isValidSuffix(dependencySuffix) ? dependencySuffix : DEFAULT_DEPENDENCY_SUFFIX;
        return new CodeActionsConfig(disabledActions, effectiveSuffix, copyFileInstallDefault, functionAliases);
    }

    public static CodeActionsConfig withDisabledActions(String... names) {
        return with(Set.of(names), DEFAULT_DEPENDENCY_SUFFIX, DEFAULT_COPY_FILE_INSTALL, Map.of());
    }

    // the suffix becomes part of an identifier
    private static boolean isValidSuffix(String suffix) {
        return suffix != null && suffix.matches("[A-Za-z0-9_]+");
    }

    private static class YamlConfig {
        public List<String> disabledActions;
        public String dependencySuffix;
        public Boolean copyFileInstallDefault;
        public Map<String, String> functionAliases;
    }
}
