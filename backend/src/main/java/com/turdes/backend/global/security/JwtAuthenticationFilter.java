package com.turdes.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.turdes.backend.modules.auth.application.JwtTokenService;
import com.turdes.backend.modules.auth.application.TokenClaims;
import com.turdes.backend.modules.auth.application.TokenType;
import com.turdes.backend.modules.auth.application.TokenVerification;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String AUTHENTICATED_AUTH_PATH = "/auth/me";

    private final JwtTokenService jwtTokenService;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, ProblemResponseWriter problemResponseWriter) {
        this.jwtTokenService = jwtTokenService;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            TokenVerification verification = jwtTokenService.verify(token, TokenType.ACCESS);
            if (!(verification instanceof TokenVerification.Verified verified)) {
                SecurityContextHolder.clearContext();
                problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED,
                        "INVALID_ACCESS_TOKEN", "Access token expired or invalid");
                return;
            }

            TokenClaims claims = verified.claims();
            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(claims.userId(), claims.email(), claims.role());
            List<SimpleGrantedAuthority> authorities = List.of(new SimpleGrantedAuthority("ROLE_" + claims.role().name()));

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.startsWith("/auth/")) {
            return !path.equals(AUTHENTICATED_AUTH_PATH);
        }
        return path.startsWith("/actuator/health");
    }
}
