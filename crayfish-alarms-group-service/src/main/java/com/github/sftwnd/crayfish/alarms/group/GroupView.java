package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Active group with its display worker and alarms at the moment of the request
 */
@AllArgsConstructor
@ToString
public final class GroupView {
    @Getter private final int groupId;
    @Getter private final long workerId;
    // Start of the display worker
    @Getter private final Instant assignedAt;
    @Getter private final List<Alarm> alarms;
}
