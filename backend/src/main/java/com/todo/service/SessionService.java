package com.todo.service;

import com.todo.dto.response.SessionResponse;
import com.todo.entity.User;
import com.todo.entity.UserSession;
import com.todo.exception.ResourceNotFoundException;
import com.todo.repository.UserSessionRepository;
import com.todo.security.RequestMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Login sessions. A bearer token is only honoured while its session is active
 * and unexpired, so every logout variant is a session deactivation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionService {

    private final UserSessionRepository sessionRepository;

    @Value("${app.auth.session-lifetime-days:30}")
    private long sessionLifetimeDays;

    @Transactional
    public UserSession open(User user, RequestMetadata metadata) {
        UserAgentParser.Parsed agent = UserAgentParser.parse(metadata.getUserAgent());
        LocalDateTime now = LocalDateTime.now();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setIpAddress(metadata.getIpAddress());
        session.setUserAgent(metadata.getUserAgent());
        session.setDeviceType(agent.getDeviceType());
        session.setBrowser(agent.getBrowser());
        session.setPlatform(agent.getPlatform());
        session.setIsActive(true);
        session.setLastActivity(now);
        session.setExpiresAt(now.plusDays(sessionLifetimeDays));

        session = sessionRepository.save(session);
        log.info("Opened session {} for user {} ({} / {} / {})",
                session.getId(), user.getId(), agent.getDeviceType(), agent.getBrowser(), agent.getPlatform());
        return session;
    }

    /**
     * Records activity on the session if it can still be used.
     *
     * @return false if the session is unknown, deactivated or expired
     */
    @Transactional
    public boolean touchIfUsable(UUID sessionId) {
        LocalDateTime now = LocalDateTime.now();
        return sessionRepository.findById(sessionId)
                .filter(session -> session.isUsableAt(now))
                .map(session -> {
                    sessionRepository.touch(sessionId, now);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> listActive(UUID userId, UUID currentSessionId) {
        return sessionRepository.findActiveByUserId(userId, LocalDateTime.now()).stream()
                .map(session -> SessionResponse.from(session, currentSessionId))
                .toList();
    }

    @Transactional
    public void deactivate(UUID sessionId) {
        if (sessionId == null) {
            return;
        }
        sessionRepository.findById(sessionId).ifPresent(session -> {
            session.deactivate();
            sessionRepository.save(session);
            log.info("Deactivated session {}", sessionId);
        });
    }

    @Transactional
    public int deactivateAll(UUID userId) {
        int count = sessionRepository.deactivateAllByUserId(userId);
        log.info("Deactivated {} session(s) for user {}", count, userId);
        return count;
    }

    @Transactional
    public int deactivateOthers(UUID userId, UUID keepSessionId) {
        if (keepSessionId == null) {
            return deactivateAll(userId);
        }
        int count = sessionRepository.deactivateAllByUserIdExcept(userId, keepSessionId);
        log.info("Deactivated {} other session(s) for user {}", count, userId);
        return count;
    }

    /**
     * Deactivates one of the user's sessions.
     *
     * @throws ResourceNotFoundException if the session does not exist or belongs to someone else
     */
    @Transactional
    public void revoke(UUID userId, UUID sessionId) {
        UserSession session = sessionRepository.findById(sessionId)
                .filter(s -> s.getUser().getId().equals(userId))
                .orElseThrow(() -> ResourceNotFoundException.of("Session", sessionId));
        session.deactivate();
        sessionRepository.save(session);
        log.info("User {} revoked session {}", userId, sessionId);
    }

    /**
     * Pushes the session's expiry a full lifetime into the future.
     *
     * @return the refreshed session
     * @throws ResourceNotFoundException if the session is unknown or not the user's
     */
    @Transactional
    public UserSession extend(UUID userId, UUID sessionId) {
        UserSession session = sessionRepository.findById(sessionId)
                .filter(s -> s.getUser().getId().equals(userId))
                .orElseThrow(() -> ResourceNotFoundException.of("Session", sessionId));
        LocalDateTime now = LocalDateTime.now();
        session.setLastActivity(now);
        session.setExpiresAt(now.plusDays(sessionLifetimeDays));
        return sessionRepository.save(session);
    }
}
