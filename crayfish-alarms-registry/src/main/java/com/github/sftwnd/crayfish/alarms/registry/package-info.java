/**
 * This package implements the shared alarm registry
 * <p>
 * The registry keeps the registered alarms ordered by their due time and owns the single lock and condition
 * used by every component that waits for structural changes of the alarm set. The table of per-group display
 * workers lives in the same lock domain.
 * </p>
 *
 * @since 1.0.0
 * @author Andrey D. Shindarev
 * @version 1.0.0
 *
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;
