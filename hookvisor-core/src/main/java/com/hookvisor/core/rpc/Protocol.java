package com.hookvisor.core.rpc;

public final class Protocol {

    /**
     * 握手时双方必须一致
     */
    public static final int VERSION = 1;

    private Protocol() {
    }
}
