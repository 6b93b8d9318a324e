package com.turdes.backend.modules.policy.application;

import com.turdes.backend.global.error.ProblemException;
import com.turdes.backend.global.error.ProblemKind;
import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.policy.domain.Action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AidRequestPolicy {

    private static final Logger log = LoggerFactory.getLogger(AidRequestPolicy.class);

    private final AbilityFactory abilityFactory;

    public AidRequestPolicy(AbilityFactory abilityFactory) {
        this.abilityFactory = abilityFactory;
    }

    public boolean allows(JwtAuthenticationPrincipal principal, Action action, Long ownerId) {
        return abilityFactory.forPrincipal(principal).can(action, ownerId);
    }

    public void check(JwtAuthenticationPrincipal principal, Action action, Long ownerId) {
        if (!allows(principal, action, ownerId)) {
            log.warn("Denied {} on aid request of owner {} for user {}", action, ownerId, principal.userId());
            throw new ProblemException(ProblemKind.FORBIDDEN, "ACCESS_DENIED", "You are not allowed to perform this action");
        }
    }
}
