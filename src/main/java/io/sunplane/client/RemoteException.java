package io.sunplane.client;

/**
 * Non-2xx answer from the object store.
 */
public final class RemoteException extends SunException {
    private final int status;
    private final String remoteMessage;

    public RemoteException(ErrorKind kind, int status, String remoteMessage) {
        super(kind, "sun: " + remoteMessage + " (status " + status + ")");
        this.status = status;
        this.remoteMessage = remoteMessage;
    }

    public int status() {
        return status;
    }

    public String remoteMessage() {
        return remoteMessage;
    }
}
