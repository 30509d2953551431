package io.vaultflow.executor;

import io.vaultflow.model.ActionType;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.WorkItem;
import io.vaultflow.util.MarkdownSections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Chat replies cannot be sent automatically; logs the approved reply text for the owner to send
 * by hand.
 */
public final class ManualReplyExecutor implements ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ManualReplyExecutor.class);
    private static final String SEPARATOR = "-".repeat(62);

    @Override
    public String id() {
        return "manual-reply";
    }

    @Override
    public Set<ActionType> actions() {
        return Set.of(ActionType.DISCORD_REPLY, ActionType.WHATSAPP_REPLY);
    }

    @Override
    public ExecutionResult execute(ExecutionContext context) {
        ApprovalRequest request = context.request();
        WorkItem item = request.item();
        String platform = request.action() == ActionType.DISCORD_REPLY ? "Discord" : "WhatsApp";
        String reply = MarkdownSections.extract(item.body(), "Draft Reply");
        if (reply.isEmpty()) {
            reply = MarkdownSections.extract(item.body(), "Message");
        }
        String channel = item.metadata("channel").or(() -> item.metadata("contact")).orElse("(unknown)");
        String author = item.metadata("author").or(() -> item.metadata("contact")).orElse("(unknown)");
        String block = "\n" + SEPARATOR + "\n"
                + "  ACTION REQUIRED -- Manual " + platform + " Reply\n"
                + "  Platform : " + platform + "\n"
                + "  Channel  : " + channel + "\n"
                + "  From     : " + author + "\n"
                + "\n  Reply text to send:\n\n"
                + reply + "\n\n"
                + "  Please send this reply manually in " + platform + ".\n"
                + SEPARATOR + "\n";
        LOG.info(block);
        return ExecutionResult.manual(block);
    }
}
