package com.turdes.backend.modules.aidrequest.application;

import java.util.List;

import com.turdes.backend.global.error.ProblemException;
import com.turdes.backend.global.error.ProblemKind;
import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.aidrequest.domain.AidRequest;
import com.turdes.backend.modules.aidrequest.domain.AidRequestStatus;
import com.turdes.backend.modules.aidrequest.infrastructure.persistence.AidRequestRepository;
import com.turdes.backend.modules.aidrequest.presentation.dto.AidRequestResponse;
import com.turdes.backend.modules.aidrequest.presentation.dto.CreateAidRequestRequest;
import com.turdes.backend.modules.policy.application.AidRequestPolicy;
import com.turdes.backend.modules.policy.domain.Action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Aid requests as seen by the policy layer. Every read and mutation is checked against the caller's ability.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AidRequestService {

    private static final Logger log = LoggerFactory.getLogger(AidRequestService.class);

    private final AidRequestRepository aidRequestRepository;
    private final AidRequestPolicy policy;

    public AidRequestService(AidRequestRepository aidRequestRepository, AidRequestPolicy policy) {
        this.aidRequestRepository = aidRequestRepository;
        this.policy = policy;
    }

    @Transactional(readOnly = true)
    public List<AidRequestResponse> listOwn(JwtAuthenticationPrincipal principal) {
        policy.check(principal, Action.READ, principal.userId());
        return aidRequestRepository.findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(principal.userId()).stream()
                .map(AidRequestResponse::from)
                .toList();
    }

    public AidRequestResponse create(JwtAuthenticationPrincipal principal, CreateAidRequestRequest request) {
        policy.check(principal, Action.CREATE, principal.userId());
        AidRequest aidRequest = new AidRequest();
        aidRequest.setOwnerId(principal.userId());
        aidRequest.setType(request.type());
        aidRequest.setDescription(request.description());
        AidRequest saved = aidRequestRepository.save(aidRequest);
        log.info("User {} created aid request {}", principal.userId(), saved.getId());
        return AidRequestResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public AidRequestResponse get(JwtAuthenticationPrincipal principal, Long id) {
        AidRequest aidRequest = load(id);
        // Someone else's request reads as missing so ids cannot be probed.
        if (!policy.allows(principal, Action.READ, aidRequest.getOwnerId())) {
            log.warn("User {} asked for aid request {} owned by {}", principal.userId(), id, aidRequest.getOwnerId());
            throw notFound();
        }
        return AidRequestResponse.from(aidRequest);
    }

    public AidRequestResponse updateStatus(JwtAuthenticationPrincipal principal, Long id, AidRequestStatus status) {
        AidRequest aidRequest = load(id);
        policy.check(principal, Action.UPDATE, aidRequest.getOwnerId());
        AidRequestStatus previous = aidRequest.getStatus();
        aidRequest.setStatus(status);
        aidRequestRepository.save(aidRequest);
        log.info("Aid request {} moved from {} to {} by user {}", id, previous, status, principal.userId());
        return AidRequestResponse.from(aidRequest);
    }

    public void softDelete(JwtAuthenticationPrincipal principal, Long id) {
        AidRequest aidRequest = load(id);
        policy.check(principal, Action.DELETE, aidRequest.getOwnerId());
        aidRequest.markDeleted();
        aidRequestRepository.save(aidRequest);
        log.info("Aid request {} deleted by user {}", id, principal.userId());
    }

    private AidRequest load(Long id) {
        return aidRequestRepository.findByIdAndDeletedFalse(id).orElseThrow(AidRequestService::notFound);
    }

    private static ProblemException notFound() {
        return new ProblemException(ProblemKind.NOT_FOUND, "AID_REQUEST_NOT_FOUND", "Aid request not found");
    }
}
