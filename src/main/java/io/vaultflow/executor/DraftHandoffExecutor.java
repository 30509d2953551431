package io.vaultflow.executor;

import io.vaultflow.model.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

public final class DraftHandoffExecutor implements ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(DraftHandoffExecutor.class);

    @Override
    public String id() {
        return "draft-handoff";
    }

    @Override
    public Set<ActionType> actions() {
        return Set.of(ActionType.DRAFT_EMAIL);
    }

    @Override
    public ExecutionResult execute(ExecutionContext context) {
        String note = "action=draft_email approved in " + context.request().id()
                + " -- create the draft for " + (context.request().target() == null ? "(unknown)" : context.request().target())
                + " from the approved text";
        LOG.info(note);
        return ExecutionResult.manual(note);
    }
}
