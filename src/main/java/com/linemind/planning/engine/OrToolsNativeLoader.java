package com.linemind.planning.engine;

import com.google.ortools.Loader;
import com.linemind.planning.exception.SolverUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the OR-Tools C++ libraries once per JVM and remembers a failed attempt,
 * so every exact call after a failure reports SOLVER_UNAVAILABLE instead of crashing.
 */
@Slf4j
@Component
public class OrToolsNativeLoader {

    private Boolean loaded;
    private Throwable failure;

    public synchronized void ensureLoaded() {
        if (loaded == null) {
            try {
                Loader.loadNativeLibraries();
                loaded = Boolean.TRUE;
                log.debug("OR-Tools native libraries loaded");
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                log.error("Could not load OR-Tools native libraries", e);
                failure = e;
                loaded = Boolean.FALSE;
            }
        }
        if (!loaded) {
            throw new SolverUnavailableException("OR-Tools native libraries are not available", failure);
        }
    }
}
