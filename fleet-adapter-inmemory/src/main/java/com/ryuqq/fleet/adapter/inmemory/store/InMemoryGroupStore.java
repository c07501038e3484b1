package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.model.Group;
import com.ryuqq.fleet.core.model.GroupId;
import com.ryuqq.fleet.core.spi.GroupStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link GroupStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryGroupStore implements GroupStore {

    private final ConcurrentHashMap<GroupId, Group> groups = new ConcurrentHashMap<>();

    @Override
    public void save(Group group) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        groups.put(group.groupId(), group);
    }

    @Override
    public Optional<Group> find(GroupId groupId) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public List<Group> findAll() {
        return groups.values().stream()
            .sorted(Comparator.comparing(Group::groupId))
            .collect(Collectors.toList());
    }
}
