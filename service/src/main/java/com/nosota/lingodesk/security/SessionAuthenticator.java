package com.nosota.lingodesk.security;

import com.nosota.lingodesk.model.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.security.web.context.SecurityContextRepository;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Binds an authenticated user to the HTTP session of the current request, and removes it again on logout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionAuthenticator {

    private final SecurityContextRepository securityContextRepository;

    public void signIn(User user) {
        ServletRequestAttributes attributes = currentRequest();
        HttpServletRequest request = attributes.getRequest();
        HttpServletResponse response = attributes.getResponse();

        if (request.getSession(false) != null) {
            request.changeSessionId();
        }

        AuthenticatedUser principal = AuthenticatedUser.of(user);
        Authentication authentication =
                UsernamePasswordAuthenticationToken.authenticated(principal, null, principal.authorities());
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
        securityContextRepository.saveContext(context, request, response);
        log.debug("Session established for userId={}", user.getId());
    }

    public void signOut() {
        ServletRequestAttributes attributes = currentRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        new SecurityContextLogoutHandler().logout(attributes.getRequest(), attributes.getResponse(), authentication);
    }

    private static ServletRequestAttributes currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes;
        }
        throw new IllegalStateException("No HTTP request bound to the current thread");
    }
}
