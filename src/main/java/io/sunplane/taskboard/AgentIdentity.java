package io.sunplane.taskboard;

import io.sunplane.config.Identities;
import io.sunplane.config.SunConfig;
import io.sunplane.util.Texts;

import java.util.Locale;

/**
 * Who is acting on a board. Only {@link #agentId()} is used as a storage key.
 */
public record AgentIdentity(String agentId, String dyad, String machine, String user) {
    public AgentIdentity {
        agentId = Texts.trim(agentId).toLowerCase(Locale.ROOT);
        dyad = Texts.trim(dyad);
        machine = Texts.trim(machine);
        user = Texts.trim(user);
    }

    /**
     * Explicit id, then the configured override, then {@code dyad:<dyad or user>@<machine>}.
     */
    public static AgentIdentity resolve(SunConfig config, String explicitAgent, String dyad, String machine) {
        String host = Identities.sanitizeSlug(Texts.firstNonBlank(machine, config.hostName(), "machine"));
        if (host.isEmpty()) {
            host = "machine";
        }
        String user = Identities.sanitizeSlug(config.userName());
        if (user.isEmpty()) {
            user = "user";
        }
        String cleanDyad = Identities.sanitizeSlug(dyad);
        String agentId = Texts.firstNonBlank(explicitAgent, config.taskboardAgent());
        if (agentId.isEmpty()) {
            agentId = "dyad:" + (cleanDyad.isEmpty() ? user : cleanDyad) + "@" + host;
        }
        return new AgentIdentity(agentId, cleanDyad, host, user);
    }
}
