package com.conveyor.engine.backend;

import java.util.Optional;

/**
 * Looks up secret values by name at step execution time.
 * Callers must not cache the result beyond the step that needs it.
 */
public interface SecretStore {

    Optional<String> resolve(String name);
}
