/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

/**
 * Alarm rejected at the registry boundary: group out of range or negative period. The registry is left unchanged.
 */
public class InvalidAlarmException extends IllegalArgumentException {

    private static final long serialVersionUID = 3187045216870149302L;

    public InvalidAlarmException(String message) {
        super(message);
    }

}
