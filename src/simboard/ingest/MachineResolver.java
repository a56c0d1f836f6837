package simboard.ingest;

/**
 * Looks up the id of a registered machine.
 */
@FunctionalInterface
public interface MachineResolver {
    /**
     * @throws simboard.core.NotFoundException if no machine has that name
     */
    long resolveMachineId(String machineName);
}
