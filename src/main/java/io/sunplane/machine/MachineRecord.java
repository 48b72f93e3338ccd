package io.sunplane.machine;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of a {@value MachineControlService#MACHINE_KIND} object.
 */
public final class MachineRecord {
    public int version = 1;
    public String machineId;
    public String displayName;
    public String ownerOperator;
    public String updatedAt;
    public String registeredAt;
    public Capabilities capabilities = new Capabilities();
    public AccessControl acl = new AccessControl();
    public Heartbeat heartbeat = new Heartbeat();

    public static final class Capabilities {
        public boolean canControlOthers;
        public boolean canBeControlled;
    }

    public static final class AccessControl {
        public List<String> allowedOperators = new ArrayList<>();
    }

    public static final class Heartbeat {
        public String lastSeenAt;
        public String lastState;
    }
}
