package simboard.core;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ConfigTest {

    @Test
    public void defaultsToInMemoryDatabase() {
        Config config = new Config(new HashMap<>());
        assertTrue(config.getDbUrl().startsWith("jdbc:h2:mem:"));
        assertFalse(config.isSqlLogEnabled());
        assertNull(config.getDeltaFields());
        assertEquals(Paths.get(System.getProperty("java.io.tmpdir")), config.getWorkDir());
    }

    @Test
    public void readsEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("SIMBOARD_DB_URL", "jdbc:h2:mem:other");
        env.put("SIMBOARD_WORK_DIR", "/scratch/simboard");
        env.put("SIMBOARD_DELTA_FIELDS", "compiler, git_tag,,");
        env.put("SQL_LOG", "1");
        Config config = new Config(env);
        assertEquals("jdbc:h2:mem:other", config.getDbUrl());
        assertEquals(Paths.get("/scratch/simboard"), config.getWorkDir());
        assertEquals(Arrays.asList("compiler", "git_tag"), config.getDeltaFields());
        assertTrue(config.isSqlLogEnabled());
    }
}
