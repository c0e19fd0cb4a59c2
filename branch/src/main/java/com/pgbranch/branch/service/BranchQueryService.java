package com.pgbranch.branch.service;

import com.pgbranch.branch.domain.BranchOperation;
import com.pgbranch.branch.domain.TrackedDatabase;
import com.pgbranch.branch.repository.BranchOperationRepository;
import com.pgbranch.branch.repository.TrackedDatabaseRepository;
import com.pgbranch.branch.storage.DatabaseAdmin;
import com.pgbranch.branch.storage.ServerDatabase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side: server databases, lineage trees and the operation history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BranchQueryService {

    private final DatabaseAdmin admin;
    private final TrackedDatabaseRepository trackedDatabases;
    private final BranchOperationRepository operations;

    public List<DatabaseListing> listDatabases() {
        Map<Long, TrackedDatabase> tracked = trackedDatabases.findAll().stream()
                .filter(TrackedDatabase::isActive)
                .collect(Collectors.toMap(TrackedDatabase::getOid, Function.identity(), (a, b) -> a));

        return admin.listDatabases().stream()
                .map(db -> DatabaseListing.builder()
                        .oid(db.getOid())
                        .name(db.getName())
                        .tracking(tracked.get(db.getOid()))
                        .build())
                .toList();
    }

    /** Lineage roots with all their descendants, oldest first at every level. */
    public List<LineageNode> listSnapshots() {
        Map<Long, String> serverNames = admin.listDatabases().stream()
                .collect(Collectors.toMap(ServerDatabase::getOid, ServerDatabase::getName, (a, b) -> a));

        List<TrackedDatabase> all = trackedDatabases.findAllByOrderByCreatedAtAsc();
        Map<Long, List<TrackedDatabase>> byParent = new LinkedHashMap<>();
        for (TrackedDatabase db : all) {
            if (!db.isRoot()) {
                byParent.computeIfAbsent(db.getParent(), k -> new ArrayList<>()).add(db);
            }
        }

        Set<Long> visited = new HashSet<>();
        List<LineageNode> roots = new ArrayList<>();
        for (TrackedDatabase db : all) {
            if (db.isRoot()) {
                roots.add(node(db, byParent, serverNames, visited));
            }
        }
        return roots;
    }

    public List<BranchOperation> listOperations() {
        return operations.findAllByOrderByIdAsc();
    }

    public List<BranchOperation> listOperations(BranchOperation.Status status) {
        return operations.findByStatusOrderByIdAsc(status);
    }

    private LineageNode node(TrackedDatabase db, Map<Long, List<TrackedDatabase>> byParent,
                             Map<Long, String> serverNames, Set<Long> visited) {
        List<LineageNode> children = new ArrayList<>();
        if (visited.add(db.getOid())) {
            for (TrackedDatabase child : byParent.getOrDefault(db.getOid(), List.of())) {
                children.add(node(child, byParent, serverNames, visited));
            }
        } else {
            log.warn("Lineage cycle detected: oid={}, datname={}", db.getOid(), db.getDatname());
        }
        return LineageNode.builder()
                .database(db)
                .currentName(db.isActive() ? serverNames.get(db.getOid()) : null)
                .children(List.copyOf(children))
                .build();
    }
}
