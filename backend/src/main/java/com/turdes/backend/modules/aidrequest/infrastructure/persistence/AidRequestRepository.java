package com.turdes.backend.modules.aidrequest.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.turdes.backend.modules.aidrequest.domain.AidRequest;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AidRequestRepository extends JpaRepository<AidRequest, Long> {

    List<AidRequest> findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(Long ownerId);

    Optional<AidRequest> findByIdAndDeletedFalse(Long id);
}
