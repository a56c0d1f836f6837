package simboard.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.core.Config;
import simboard.core.DAO;
import simboard.core.DbPool;
import simboard.ingest.IngestConfig;
import simboard.ingest.Ingestions;
import simboard.machine.Machines;
import simboard.simulation.Simulations;

import javax.sql.DataSource;
import java.io.PrintWriter;

public class Simboard implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Simboard.class);

    public final Config config;
    private final DbPool dbPool;
    public final DAO dao;

    public final Machines machines;
    public final Simulations simulations;
    public final Ingestions ingestions;

    public Simboard(Config config) {
        long startTime = System.currentTimeMillis();

        this.config = config;

        dbPool = new DbPool(config);
        dbPool.migrate();
        dao = dbPool.dao();

        this.machines = new Machines(dao.machines());
        this.simulations = new Simulations(dao.simulations());
        this.ingestions = new Ingestions(dao, IngestConfig.from(config), machines, simulations);

        log.info("Initialized SimBoard in " + (System.currentTimeMillis() - startTime) + "ms");
    }

    public void close() {
        dbPool.close();
    }

    public boolean healthcheck(PrintWriter out) {
        boolean allOk = dbPool.healthcheck(out);
        if (allOk) {
            out.println("\nALL OK");
        }
        return allOk;
    }

    public DataSource getDataSource() {
        return dbPool.getDataSource();
    }
}
