package com.cw.contentflow.repository;

import com.cw.contentflow.entity.Fingerprint;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FingerprintRepository extends JpaRepository<Fingerprint, String> {
}
