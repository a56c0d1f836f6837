package simboard.machine;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindBean;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@RegisterRowMapper(MachinesDAO.MachineMapper.class)
public interface MachinesDAO {

    class MachineMapper implements RowMapper<Machine> {
        @Override
        public Machine map(ResultSet r, StatementContext ctx) throws SQLException {
            return new Machine(r);
        }
    }

    @SqlQuery("SELECT * FROM machine WHERE id = :id")
    Machine findMachineById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM machine WHERE name = :name")
    Machine findMachineByName(@Bind("name") String name);

    @SqlQuery("SELECT * FROM machine ORDER BY name")
    List<Machine> listMachines();

    @SqlUpdate("INSERT INTO machine (name, site, architecture, scheduler, gpu) VALUES (:name, :site, :architecture, :scheduler, :gpu)")
    @GetGeneratedKeys
    long createMachine(@BindBean Machine machine);
}
