package dev.fumaz.bracket.resource;

/**
 * A resource whose close capability cannot report a checked failure.
 */
public interface SafeCloseable extends AutoCloseable {

    /**
     * Releases the resource.
     */
    @Override
    void close();
}
