package com.pgbranch.branch.repository;

import com.pgbranch.branch.domain.BranchOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BranchOperationRepository extends JpaRepository<BranchOperation, Long> {

    List<BranchOperation> findAllByOrderByIdAsc();

    List<BranchOperation> findByStatusOrderByIdAsc(BranchOperation.Status status);
}
