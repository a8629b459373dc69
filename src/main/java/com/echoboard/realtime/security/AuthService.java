package com.echoboard.realtime.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Optional;

@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    @Inject
    JsonWebToken jwt;

    /**
     * Identity of the caller from the bearer token of the upgrade request.
     * Empty when the request carried no token.
     */
    public Optional<Identity> currentIdentity() {
        try {
            String subject = jwt.getSubject();
            if (subject == null || subject.isBlank()) {
                return Optional.empty();
            }
            String username = jwt.getClaim("preferred_username");
            if (username == null || username.isBlank()) {
                username = jwt.getName() != null ? jwt.getName() : subject;
            }
            return Optional.of(new Identity(subject, username.toLowerCase(Locale.ROOT)));
        } catch (RuntimeException e) {
            LOG.debugf("No usable token on connection: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
