package com.signalmix.external;

import com.signalmix.config.Config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of configured collaborators by name. Blank commands leave a name unconfigured.
 */
public final class Collaborators {
    public static final String SWING_MODEL = "swing-model";
    public static final String MICROCAP_SCANNER = "microcap-scanner";
    public static final String MARKET_CAPS = "market-caps";
    public static final String NEWS_API = "news-api";
    public static final String NEWS_RSS = "news-rss";
    public static final List<String> NAMES = List.of(SWING_MODEL, MICROCAP_SCANNER, MARKET_CAPS, NEWS_API, NEWS_RSS);

    private final Map<String, ExternalCollaborator> byName;
    private final int workers;

    public Collaborators(Map<String, ExternalCollaborator> byName, int workers) {
        this.byName = byName == null ? Map.of() : Map.copyOf(byName);
        this.workers = workers <= 0 ? 1 : workers;
    }

    public static Collaborators none() {
        return new Collaborators(Map.of(), 1);
    }

    public static Collaborators fromConfig(Config config) {
        Map<String, String> commands = new LinkedHashMap<>();
        for (String name : NAMES) {
            commands.put(name, config.getString("collaborator.commands." + name, ""));
        }
        return fromCommands(commands, config.getInt("collaborator.workers", 8), config.workingDir());
    }

    public static Collaborators fromCommands(Map<String, String> commands, int workers, Path workingDir) {
        Map<String, ExternalCollaborator> out = new LinkedHashMap<>();
        if (commands != null) {
            for (Map.Entry<String, String> entry : commands.entrySet()) {
                String commandLine = entry.getValue();
                if (entry.getKey() == null || commandLine == null || commandLine.isBlank()) {
                    continue;
                }
                out.put(entry.getKey(), new CommandCollaborator(entry.getKey(), commandLine.trim(), workingDir));
            }
        }
        return new Collaborators(out, workers);
    }

    public Optional<ExternalCollaborator> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int workers() {
        return workers;
    }

    public int size() {
        return byName.size();
    }
}
