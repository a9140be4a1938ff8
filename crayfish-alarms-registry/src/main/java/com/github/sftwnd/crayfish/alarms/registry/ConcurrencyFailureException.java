/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

/**
 * Broken lock or condition usage. Shared state can not be trusted after it, so the owner of the thread
 * has to treat it as fatal.
 */
public class ConcurrencyFailureException extends IllegalStateException {

    private static final long serialVersionUID = -5301874662104718544L;

    public ConcurrencyFailureException(String message) {
        super(message);
    }

    public ConcurrencyFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
