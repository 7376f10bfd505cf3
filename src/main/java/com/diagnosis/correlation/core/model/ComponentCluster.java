package com.diagnosis.correlation.core.model;

import java.util.List;

/**
 * A maximal connected group of canonical entities with at least two members.
 *
 * @param clusterId        1-based id in discovery order
 * @param members          member canonical names in visit order
 * @param primaryComponent the entity the traversal started from
 */
public record ComponentCluster(int clusterId, List<String> members, String primaryComponent) {

    public ComponentCluster {
        members = ModelCollections.listCopy(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("A cluster needs at least two members");
        }
    }

    public int size() {
        return members.size();
    }
}
