package com.signalmix.external;

import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;

import java.util.Map;
import java.util.Optional;

/**
 * Invokes one collaborator and turns every failure mode into a stage outcome.
 * The value is the exit code, or {@link #NOT_RUN}.
 */
public final class CollaboratorStep {
    public static final int NOT_RUN = -1;

    private CollaboratorStep() {
    }

    public static StageOutcome<Integer> invoke(Collaborators collaborators, String name, CollaboratorRequest request) {
        String owner = "external." + name;
        Optional<ExternalCollaborator> collaborator = collaborators.find(name);
        if (collaborator.isEmpty()) {
            return StageOutcome.degraded(NOT_RUN, CauseCode.MISSING_INPUT, owner, "collaborator not configured");
        }
        int exit;
        try {
            exit = collaborator.get().run(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("WARN: collaborator interrupted, name=" + name);
            return StageOutcome.failed(NOT_RUN, CauseCode.UPSTREAM_FAILURE, owner, "interrupted");
        } catch (Exception e) {
            System.err.println("WARN: collaborator failed, name=" + name + ", err=" + e.getMessage());
            return StageOutcome.failed(NOT_RUN, CauseCode.UPSTREAM_FAILURE, owner, String.valueOf(e.getMessage()));
        }
        if (exit != 0) {
            System.err.println("WARN: collaborator exited non-zero, name=" + name + ", exit=" + exit);
            return StageOutcome.failed(exit, CauseCode.UPSTREAM_FAILURE, owner, "exit code " + exit);
        }
        return StageOutcome.ok(exit, owner, Map.of("exit", exit));
    }
}
