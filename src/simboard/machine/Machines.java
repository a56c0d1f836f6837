package simboard.machine;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import simboard.core.NotFoundException;
import simboard.ingest.MachineResolver;

import java.util.List;
import java.util.Set;

public class Machines implements MachineResolver {
    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final MachinesDAO dao;

    public Machines(MachinesDAO machinesDAO) {
        this.dao = machinesDAO;
    }

    public Machine getOrNull(long id) {
        return dao.findMachineById(id);
    }

    /**
     * @throws NotFoundException if the machine doesn't exist
     */
    public Machine get(long id) {
        return NotFoundException.check(getOrNull(id), "machine", id);
    }

    public Machine getByNameOrNull(String name) {
        return dao.findMachineByName(name);
    }

    public List<Machine> listAll() {
        return dao.listMachines();
    }

    /**
     * Registers a machine.
     *
     * @return the id of the new machine
     * @throws ConstraintViolationException if a field is missing
     */
    public long create(Machine machine) {
        Set<ConstraintViolation<Machine>> violations = validator.validate(machine);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return dao.createMachine(machine);
    }

    @Override
    public long resolveMachineId(String machineName) {
        Machine machine = getByNameOrNull(machineName);
        if (machine == null) {
            throw new NotFoundException("Machine '" + machineName + "' not found in database. "
                    + "Please ensure the machine exists before uploading.");
        }
        return machine.getId();
    }
}
