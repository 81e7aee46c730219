package com.todo.service;

import com.todo.entity.User;
import com.todo.entity.UserSession;
import com.todo.exception.ResourceNotFoundException;
import com.todo.repository.UserSessionRepository;
import com.todo.security.RequestMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionService Unit Tests")
class SessionServiceTest {

    @Mock
    private UserSessionRepository sessionRepository;

    @InjectMocks
    private SessionService sessionService;

    private User user;
    private UserSession session;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(sessionService, "sessionLifetimeDays", 30L);

        user = new User("Jane", "jane@example.com", "hash");
        user.setId(UUID.randomUUID());

        session = new UserSession();
        session.setId(UUID.randomUUID());
        session.setUser(user);
        session.setIsActive(true);
        session.setExpiresAt(LocalDateTime.now().plusDays(1));
    }

    @Test
    @DisplayName("open should record the parsed client and a thirty day expiry")
    void testOpen() {
        when(sessionRepository.save(any(UserSession.class))).thenAnswer(inv -> inv.getArgument(0));

        UserSession opened = sessionService.open(user, new RequestMetadata("10.0.0.9",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:121.0) Gecko/20100101 Firefox/121.0"));

        assertEquals("10.0.0.9", opened.getIpAddress());
        assertEquals("Firefox", opened.getBrowser());
        assertEquals("macOS", opened.getPlatform());
        assertEquals("Desktop", opened.getDeviceType());
        assertTrue(opened.getIsActive());
        assertTrue(opened.getExpiresAt().isAfter(LocalDateTime.now().plusDays(29)));
    }

    @Test
    @DisplayName("touchIfUsable should refuse deactivated and expired sessions")
    void testTouchIfUsable() {
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));
        assertTrue(sessionService.touchIfUsable(session.getId()));
        verify(sessionRepository).touch(eq(session.getId()), any(LocalDateTime.class));

        session.setExpiresAt(LocalDateTime.now().minusSeconds(1));
        assertFalse(sessionService.touchIfUsable(session.getId()));

        session.setExpiresAt(LocalDateTime.now().plusDays(1));
        session.deactivate();
        assertFalse(sessionService.touchIfUsable(session.getId()));

        UUID unknown = UUID.randomUUID();
        when(sessionRepository.findById(unknown)).thenReturn(Optional.empty());
        assertFalse(sessionService.touchIfUsable(unknown));
    }

    @Test
    @DisplayName("deactivateOthers without a current session should end all of them")
    void testDeactivateOthers_NoCurrentSession() {
        when(sessionRepository.deactivateAllByUserId(user.getId())).thenReturn(3);

        assertEquals(3, sessionService.deactivateOthers(user.getId(), null));
        verify(sessionRepository, never()).deactivateAllByUserIdExcept(any(), any());
    }

    @Test
    @DisplayName("revoke should not reveal another user's session")
    void testRevoke_OtherUser() {
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));

        assertThrows(ResourceNotFoundException.class,
                () -> sessionService.revoke(UUID.randomUUID(), session.getId()));
        assertTrue(session.getIsActive());
    }

    @Test
    @DisplayName("extend should push the expiry a full lifetime forward")
    void testExtend() {
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));
        when(sessionRepository.save(session)).thenReturn(session);

        UserSession extended = sessionService.extend(user.getId(), session.getId());

        assertTrue(extended.getExpiresAt().isAfter(LocalDateTime.now().plusDays(29)));
        assertNotNull(extended.getLastActivity());
    }
}
