package workout.logger.api.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import workout.logger.api.entity.User;
import workout.logger.api.repository.UserRepository;
import workout.logger.api.security.Principal;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserService userService;

    @Test
    void getOrCreateUser_FirstSeen_ShouldRegisterWithTokenIdAndEmail() {
        // Given
        when(userRepository.findById(17L)).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        User user = userService.getOrCreateUser(new Principal(17L, "lifter@example.com"));

        // Then
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).saveAndFlush(captor.capture());
        assertEquals(17L, captor.getValue().getId());
        assertEquals("lifter@example.com", user.getEmail());
    }

    @Test
    void getOrCreateUser_Known_ShouldNotSaveWhenEmailUnchanged() {
        // Given
        User existing = new User();
        existing.setId(17L);
        existing.setEmail("lifter@example.com");
        when(userRepository.findById(17L)).thenReturn(Optional.of(existing));

        // When
        User user = userService.getOrCreateUser(new Principal(17L, "lifter@example.com"));

        // Then
        assertSame(existing, user);
        verify(userRepository, never()).save(any());
    }

    @Test
    void getOrCreateUser_Known_ShouldUpdateChangedEmail() {
        // Given
        User existing = new User();
        existing.setId(17L);
        existing.setEmail("old@example.com");
        when(userRepository.findById(17L)).thenReturn(Optional.of(existing));

        // When
        userService.getOrCreateUser(new Principal(17L, "new@example.com"));

        // Then
        assertEquals("new@example.com", existing.getEmail());
        verify(userRepository).save(existing);
    }

    @Test
    void getOrCreateUser_WhenConcurrentRequestRegisteredFirst_ShouldReturnStoredUser() {
        // Given
        User winner = new User();
        winner.setId(17L);
        winner.setEmail("lifter@example.com");
        when(userRepository.findById(17L)).thenReturn(Optional.empty(), Optional.of(winner));
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint \"users_pkey\""));

        // When
        User user = userService.getOrCreateUser(new Principal(17L, "lifter@example.com"));

        // Then
        assertSame(winner, user);
        verify(userRepository, times(2)).findById(17L);
    }

    @Test
    void getOrCreateUser_WhenInsertFailsForAnotherReason_ShouldRethrow() {
        // Given
        DataIntegrityViolationException failure =
                new DataIntegrityViolationException("duplicate key value violates unique constraint \"users_email_key\"");
        when(userRepository.findById(17L)).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(failure);

        // When / Then
        DataIntegrityViolationException thrown = assertThrows(DataIntegrityViolationException.class,
                () -> userService.getOrCreateUser(new Principal(17L, "taken@example.com")));
        assertSame(failure, thrown);
    }
}
