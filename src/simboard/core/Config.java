package simboard.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class Config {
    private final Map<String, String> env;

    public Config(Map<String, String> env) {
        this.env = env;
    }

    private String getEnv(String name, String defaultValue) {
        return env.getOrDefault(name, defaultValue);
    }

    public String getDbUser() {
        return getEnv("SIMBOARD_DB_USER", "simboard");
    }

    public String getDbPassword() {
        return getEnv("SIMBOARD_DB_PASSWORD", "simboard");
    }

    public String getDbUrl() {
        return getEnv("SIMBOARD_DB_URL", "jdbc:h2:mem:simboard;db_close_delay=-1");
    }

    public boolean isSqlLogEnabled() {
        return getEnv("SQL_LOG", null) != null;
    }

    /**
     * Directory under which each ingestion gets its own extraction directory.
     */
    public Path getWorkDir() {
        return Paths.get(getEnv("SIMBOARD_WORK_DIR", System.getProperty("java.io.tmpdir")));
    }

    /**
     * Comma separated override of the configuration fields compared between runs of the same case.
     * Returns null when the default allow-list should be used.
     */
    public List<String> getDeltaFields() {
        String value = getEnv("SIMBOARD_DELTA_FIELDS", "");
        if (value.isEmpty()) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        for (String field : value.split(",")) {
            if (!field.isBlank()) {
                fields.add(field.trim());
            }
        }
        return Collections.unmodifiableList(fields);
    }
}
