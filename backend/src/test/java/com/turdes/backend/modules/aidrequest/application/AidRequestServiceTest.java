package com.turdes.backend.modules.aidrequest.application;

import static com.turdes.backend.support.ProblemAssertions.assertProblem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.turdes.backend.global.error.ProblemKind;
import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.aidrequest.domain.AidRequest;
import com.turdes.backend.modules.aidrequest.domain.AidRequestStatus;
import com.turdes.backend.modules.aidrequest.infrastructure.persistence.AidRequestRepository;
import com.turdes.backend.modules.aidrequest.presentation.dto.CreateAidRequestRequest;
import com.turdes.backend.modules.auth.domain.Role;
import com.turdes.backend.modules.policy.application.AbilityFactory;
import com.turdes.backend.modules.policy.application.AidRequestPolicy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AidRequestServiceTest {

    @Mock
    private AidRequestRepository aidRequestRepository;

    private AidRequestService service;

    private final JwtAuthenticationPrincipal owner = new JwtAuthenticationPrincipal(5L, "owner@x.com", Role.USER);
    private final JwtAuthenticationPrincipal stranger = new JwtAuthenticationPrincipal(6L, "other@x.com", Role.USER);
    private final JwtAuthenticationPrincipal admin = new JwtAuthenticationPrincipal(1L, "admin@x.com", Role.ADMIN);

    @BeforeEach
    void setUp() {
        service = new AidRequestService(aidRequestRepository, new AidRequestPolicy(new AbilityFactory()));
    }

    @Test
    void createAssignsCallerAsOwner() {
        when(aidRequestRepository.save(any(AidRequest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        var response = service.create(owner, new CreateAidRequestRequest("food", "Family of four needs supplies"));

        assertThat(response.ownerId()).isEqualTo(5L);
        assertThat(response.status()).isEqualTo(AidRequestStatus.PENDING);
    }

    @Test
    void onlyOwnerOrAdminCanRead() {
        when(aidRequestRepository.findByIdAndDeletedFalse(10L)).thenReturn(Optional.of(requestOwnedBy(5L)));

        assertThat(service.get(owner, 10L).id()).isEqualTo(10L);
        assertThat(service.get(admin, 10L).id()).isEqualTo(10L);
    }

    @Test
    void strangerSeesSomeoneElsesRequestAsMissing() {
        when(aidRequestRepository.findByIdAndDeletedFalse(10L)).thenReturn(Optional.of(requestOwnedBy(5L)));
        when(aidRequestRepository.findByIdAndDeletedFalse(404L)).thenReturn(Optional.empty());

        var existing = assertProblem(() -> service.get(stranger, 10L), ProblemKind.NOT_FOUND, "AID_REQUEST_NOT_FOUND");
        var missing = assertProblem(() -> service.get(stranger, 404L), ProblemKind.NOT_FOUND, "AID_REQUEST_NOT_FOUND");

        assertThat(existing.getDetailMessage()).isEqualTo(missing.getDetailMessage());
    }

    @Test
    void ownerCannotChangeStatusButAdminCan() {
        AidRequest request = requestOwnedBy(5L);
        when(aidRequestRepository.findByIdAndDeletedFalse(10L)).thenReturn(Optional.of(request));

        assertProblem(() -> service.updateStatus(owner, 10L, AidRequestStatus.APPROVED),
                ProblemKind.FORBIDDEN, "ACCESS_DENIED");
        assertThat(request.getStatus()).isEqualTo(AidRequestStatus.PENDING);

        var updated = service.updateStatus(admin, 10L, AidRequestStatus.APPROVED);
        assertThat(updated.status()).isEqualTo(AidRequestStatus.APPROVED);
    }

    @Test
    void softDeleteIsAdminOnly() {
        AidRequest request = requestOwnedBy(5L);
        when(aidRequestRepository.findByIdAndDeletedFalse(10L)).thenReturn(Optional.of(request));

        assertProblem(() -> service.softDelete(owner, 10L), ProblemKind.FORBIDDEN, "ACCESS_DENIED");
        verify(aidRequestRepository, never()).save(any());

        service.softDelete(admin, 10L);
        assertThat(request.isDeleted()).isTrue();
    }

    @Test
    void missingRequestIsNotFound() {
        when(aidRequestRepository.findByIdAndDeletedFalse(404L)).thenReturn(Optional.empty());

        assertProblem(() -> service.get(admin, 404L), ProblemKind.NOT_FOUND, "AID_REQUEST_NOT_FOUND");
    }

    private static AidRequest requestOwnedBy(Long ownerId) {
        AidRequest request = new AidRequest();
        ReflectionTestUtils.setField(request, "id", 10L);
        request.setOwnerId(ownerId);
        request.setType("shelter");
        request.setDescription("Roof damaged");
        return request;
    }
}
