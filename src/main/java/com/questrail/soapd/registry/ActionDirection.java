package com.questrail.soapd.registry;

/**
 * Direction of a WS-Addressing action: the action clients put on requests
 * ({@link #INPUT}) or the one the server puts on replies ({@link #OUTPUT}).
 */
public enum ActionDirection {
    INPUT,
    OUTPUT
}
