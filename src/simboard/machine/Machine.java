package simboard.machine;

import jakarta.validation.constraints.NotBlank;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Date;

/**
 * An HPC system simulations run on. Archives refer to machines by name.
 */
public class Machine {
    private Long id;
    @NotBlank private String name;
    @NotBlank private String site;
    @NotBlank private String architecture;
    @NotBlank private String scheduler;
    private boolean gpu;
    private Date created;

    public Machine() {
    }

    public Machine(ResultSet rs) throws SQLException {
        setId(rs.getLong("id"));
        setName(rs.getString("name"));
        setSite(rs.getString("site"));
        setArchitecture(rs.getString("architecture"));
        setScheduler(rs.getString("scheduler"));
        setGpu(rs.getBoolean("gpu"));
        Timestamp created = rs.getTimestamp("created");
        setCreated(created == null ? null : new Date(created.getTime()));
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public String getArchitecture() {
        return architecture;
    }

    public void setArchitecture(String architecture) {
        this.architecture = architecture;
    }

    public String getScheduler() {
        return scheduler;
    }

    public void setScheduler(String scheduler) {
        this.scheduler = scheduler;
    }

    public boolean isGpu() {
        return gpu;
    }

    public void setGpu(boolean gpu) {
        this.gpu = gpu;
    }

    public Date getCreated() {
        return created;
    }

    public void setCreated(Date created) {
        this.created = created;
    }
}
