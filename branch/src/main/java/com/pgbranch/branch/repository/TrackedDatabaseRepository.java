package com.pgbranch.branch.repository;

import com.pgbranch.branch.domain.TrackedDatabase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrackedDatabaseRepository extends JpaRepository<TrackedDatabase, Long> {

    Optional<TrackedDatabase> findFirstByDatnameAndStatus(String datname, TrackedDatabase.Status status);

    List<TrackedDatabase> findByDatnameAndStatus(String datname, TrackedDatabase.Status status);

    List<TrackedDatabase> findAllByOrderByCreatedAtAsc();
}
