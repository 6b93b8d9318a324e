package com.turdes.backend.modules.aidrequest.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.aidrequest.application.AidRequestService;
import com.turdes.backend.modules.aidrequest.domain.AidRequestStatus;
import com.turdes.backend.modules.aidrequest.presentation.dto.AidRequestResponse;
import com.turdes.backend.modules.auth.application.JwtTokenService;
import com.turdes.backend.modules.auth.application.TokenClaims;
import com.turdes.backend.modules.auth.application.TokenType;
import com.turdes.backend.modules.auth.application.TokenVerification;
import com.turdes.backend.modules.auth.domain.Role;
import com.turdes.backend.support.WebLayerTestConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AidRequestController.class)
@Import(WebLayerTestConfig.class)
class AidRequestControllerTest {

    private static final Instant EXPIRES = Instant.parse("2030-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AidRequestService aidRequestService;

    @MockBean
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        when(jwtTokenService.verify("user-token", TokenType.ACCESS)).thenReturn(new TokenVerification.Verified(
                new TokenClaims(5L, "user@x.com", Role.USER, TokenType.ACCESS, EXPIRES)));
        when(jwtTokenService.verify("admin-token", TokenType.ACCESS)).thenReturn(new TokenVerification.Verified(
                new TokenClaims(1L, "admin@x.com", Role.ADMIN, TokenType.ACCESS, EXPIRES)));
    }

    @Test
    void anonymousCallersAreRejected() throws Exception {
        mockMvc.perform(get("/aid-requests"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(aidRequestService);
    }

    @Test
    void listPassesVerifiedPrincipalToService() throws Exception {
        when(aidRequestService.listOwn(any(JwtAuthenticationPrincipal.class))).thenReturn(List.of());

        mockMvc.perform(get("/aid-requests").header("Authorization", "Bearer user-token"))
                .andExpect(status().isOk());

        verify(aidRequestService).listOwn(new JwtAuthenticationPrincipal(5L, "user@x.com", Role.USER));
    }

    @Test
    void usersCannotChangeStatus() throws Exception {
        mockMvc.perform(patch("/aid-requests/10/status")
                        .header("Authorization", "Bearer user-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "APPROVED"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCESS_DENIED"));

        verifyNoInteractions(aidRequestService);
    }

    @Test
    void adminsCanChangeStatus() throws Exception {
        when(aidRequestService.updateStatus(any(JwtAuthenticationPrincipal.class), eq(10L), eq(AidRequestStatus.APPROVED)))
                .thenReturn(new AidRequestResponse(10L, 5L, "food", "Supplies", AidRequestStatus.APPROVED, null, null));

        mockMvc.perform(patch("/aid-requests/10/status")
                        .header("Authorization", "Bearer admin-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "APPROVED"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    void usersCannotDelete() throws Exception {
        mockMvc.perform(patch("/aid-requests/10/delete").header("Authorization", "Bearer user-token"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(aidRequestService);
    }
}
