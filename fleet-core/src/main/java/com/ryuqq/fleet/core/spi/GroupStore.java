package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.Group;
import com.ryuqq.fleet.core.model.GroupId;

import java.util.List;
import java.util.Optional;

/**
 * Storage SPI for static and dynamic groups.
 *
 * <p>Dynamic group definitions are stored as expression trees and evaluated by the
 * target resolver on every resolution; implementations must not cache membership.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface GroupStore {

    /**
     * Inserts or replaces a group definition.
     *
     * @param group the group
     * @throws IllegalArgumentException if group is null
     */
    void save(Group group);

    Optional<Group> find(GroupId groupId);

    List<Group> findAll();
}
