package com.cw.contentflow.repository;

import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ContentPackageRepository extends JpaRepository<ContentPackage, Long> {
    boolean existsByTraceIdAndRecordType(String traceId, RecordType recordType);

    Optional<ContentPackage> findFirstByTraceIdAndRecordType(String traceId, RecordType recordType);

    long countByRecordType(RecordType recordType);

    List<ContentPackage> findTop200ByRecordTypeOrderByIdDesc(RecordType recordType);

    // 대시보드 조회
    List<ContentPackage> findAllByOrderByIdDesc(Pageable pageable);
    List<ContentPackage> findByRecordTypeOrderByIdDesc(RecordType recordType, Pageable pageable);
    List<ContentPackage> findByTraceIdOrderByIdDesc(String traceId, Pageable pageable);
    List<ContentPackage> findByRecordTypeAndTraceIdOrderByIdDesc(RecordType recordType, String traceId, Pageable pageable);
}
