package com.phillippitts.autoremediation.service.remediation;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // Keep stderr separate from stdout (we capture both)
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
