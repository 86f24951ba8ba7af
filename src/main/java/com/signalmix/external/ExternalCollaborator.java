package com.signalmix.external;

/**
 * An out-of-process producer of an input artifact (model, scanner, fetcher).
 */
public interface ExternalCollaborator {
    String name();

    /**
     * @return process-style exit code, zero on success
     */
    int run(CollaboratorRequest request) throws Exception;
}
