package simboard.core;

import org.junit.rules.ExternalResource;
import org.junit.rules.TemporaryFolder;
import simboard.machine.Machine;

public class Fixtures extends ExternalResource {

    public TemporaryFolder tmp = new TemporaryFolder();
    public long machineId;
    public TestConfig config;
    public DbPool dbPool;
    public DAO dao;

    @Override
    protected void before() throws Throwable {
        tmp.create();
        config = new TestConfig();
        config.setWorkDir(tmp.newFolder("work").toPath());
        dbPool = new DbPool(config);

        dbPool.migrate();

        dao = dbPool.dao();

        Machine machine = new Machine();
        machine.setName("chrysalis");
        machine.setSite("ANL");
        machine.setArchitecture("x86_64");
        machine.setScheduler("slurm");
        machineId = dao.machines().createMachine(machine);
    }

    @Override
    protected void after() {
        dbPool.close();
        tmp.delete();
    }
}
