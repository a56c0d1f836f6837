package simboard.core;

import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.core.transaction.SerializableTransactionRunner;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vibur.dbcp.ViburDBCPDataSource;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.PrintWriter;

public class DbPool implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(DbPool.class);

    final ViburDBCPDataSource ds;
    public final Jdbi dbi;
    private final DAO dao;

    public DbPool(Config config) {
        long start = System.currentTimeMillis();

        ds = new ViburDBCPDataSource();
        ds.setPoolInitialSize(1);
        ds.setPoolMaxSize(16);
        ds.setName("SimboardDBPool");
        ds.setJdbcUrl(config.getDbUrl());
        ds.setUsername(config.getDbUser());
        ds.setPassword(config.getDbPassword());
        ds.start();

        log.info("Initialized connection pool in {}ms", System.currentTimeMillis() - start);

        dbi = Jdbi.create(ds).installPlugin(new SqlObjectPlugin());
        dbi.setTransactionHandler(new SerializableTransactionRunner());

        if (config.isSqlLogEnabled()) {
            dbi.setSqlLogger(new Slf4JSqlLogger());
        }

        dao = dbi.onDemand(DAO.class);
    }

    public void migrate() {
        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:simboard/migrations")
                .load()
                .migrate();
    }

    public DAO dao() {
        return dao;
    }

    @Override
    public void close() {
        ds.terminate();
    }

    public boolean healthcheck(PrintWriter out) {
        out.print("Checking database connection... ");
        try (Handle h = dbi.open()) {
            boolean ok = h.select("select 1").mapTo(Integer.class).findOne().isPresent();
            out.println(ok ? "OK" : "FAILED");
            return ok;
        } catch (Exception e) {
            out.println("ERROR");
            e.printStackTrace(out);
            return false;
        }
    }

    public DataSource getDataSource() {
        return ds;
    }
}
