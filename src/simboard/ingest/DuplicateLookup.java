package simboard.ingest;

@FunctionalInterface
public interface DuplicateLookup {
    boolean exists(DeduplicationKey key);
}
