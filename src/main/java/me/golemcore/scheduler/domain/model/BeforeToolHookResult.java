package me.golemcore.scheduler.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict of the before-tool hooks.
 *
 * @param decision
 *            allow, block, or defer to approval
 * @param modifiedArgs
 *            replacement arguments (allow only), null to keep the originals
 * @param reason
 *            reason for a block or a deferral
 */
public record BeforeToolHookResult(Decision decision, Map<String, Object> modifiedArgs, String reason) {

    public BeforeToolHookResult {
        if (decision == null) {
            decision = Decision.ALLOW;
        }
        if (modifiedArgs != null) {
            modifiedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(modifiedArgs));
        }
    }

    public static BeforeToolHookResult allow() {
        return new BeforeToolHookResult(Decision.ALLOW, null, null);
    }

    public static BeforeToolHookResult allowWithArgs(Map<String, Object> args) {
        return new BeforeToolHookResult(Decision.ALLOW, args, null);
    }

    public static BeforeToolHookResult block(String reason) {
        return new BeforeToolHookResult(Decision.BLOCK, null, reason);
    }

    public static BeforeToolHookResult ask(String reason) {
        return new BeforeToolHookResult(Decision.ASK, null, reason);
    }

    public enum Decision {
        ALLOW, BLOCK, ASK
    }
}
