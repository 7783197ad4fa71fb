package org.scharp.psrwriter;

/**
 * A lookup service that maps telescope names to their location.
 */
@FunctionalInterface
public interface TelescopeRegistry {

    /**
     * Finds a telescope by name.
     *
     * @param name
     *     The telescope name, as given in {@link UnifiedHeader#telescope()}.
     *
     * @return The telescope, or {@code null} if the name isn't recognized.
     */
    Telescope find(String name);

    /**
     * Gets a registry of the observatories that commonly produce Filterbank and PSRFITS data.
     *
     * @return The built-in registry.
     */
    static TelescopeRegistry builtIn() {
        return KnownTelescopes.INSTANCE;
    }
}
