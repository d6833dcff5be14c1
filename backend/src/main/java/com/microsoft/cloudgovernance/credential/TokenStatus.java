package com.microsoft.cloudgovernance.credential;

public enum TokenStatus {
    /** Usable token returned. */
    VALID,
    /** No credential stored; the client never completed setup. */
    NOT_CONFIGURED,
    /** Credential exists but was rejected; the client must re-authenticate. */
    INVALID,
    /** Identity provider unreachable; retry later. */
    UNAVAILABLE
}
