package com.turdes.backend.modules.policy.application;

import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.policy.domain.Ability;
import com.turdes.backend.modules.policy.domain.Ability.Permission;
import com.turdes.backend.modules.policy.domain.Action;

import org.springframework.stereotype.Component;

@Component
public class AbilityFactory {

    public Ability forPrincipal(JwtAuthenticationPrincipal principal) {
        if (principal.isAdmin()) {
            return Ability.of(Permission.anyOwner(Action.MANAGE));
        }
        return Ability.of(
                Permission.ownedBy(Action.CREATE, principal.userId()),
                Permission.ownedBy(Action.READ, principal.userId())
        );
    }
}
