package com.garment.materials.repository;

import com.garment.materials.model.GoodsIssue;
import com.garment.materials.model.IssueStatus;
import com.garment.materials.model.IssueType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface GoodsIssueRepository extends JpaRepository<GoodsIssue, Long> {

    Optional<GoodsIssue> findTopByOrderByIdDesc();

    List<GoodsIssue> findAllByOrderByCreatedAtDesc();

    List<GoodsIssue> findByStatusOrderByIssueDateAsc(IssueStatus status);

    List<GoodsIssue> findByIssueTypeOrderByIssueDateDesc(IssueType issueType);
}
