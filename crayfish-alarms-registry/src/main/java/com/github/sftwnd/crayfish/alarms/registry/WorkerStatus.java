/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

/**
 * State of the display worker slot of a group
 */
public enum WorkerStatus {
    INACTIVE, ACTIVE, STOP_REQUESTED
}
