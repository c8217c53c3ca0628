package com.fdsl.flow.chain;

public enum ChainDirection {
    /** Client message toward the external publish sink. */
    INBOUND,
    /** External subscribe source toward the client. */
    OUTBOUND
}
