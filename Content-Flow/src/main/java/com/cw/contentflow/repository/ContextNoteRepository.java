package com.cw.contentflow.repository;

import com.cw.contentflow.entity.ContextNote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface ContextNoteRepository extends JpaRepository<ContextNote, Long> {
    List<ContextNote> findTop200ByOrderByIdDesc();

    @Transactional
    @Modifying
    @Query("delete from ContextNote n where n.createdAt <= :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
