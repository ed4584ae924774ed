package com.authbridge.bridge.infrastructure.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.authbridge.credentials.DirectoryAuthenticationException;
import com.authbridge.credentials.DirectoryClient;
import com.authbridge.credentials.DirectoryConnectException;
import com.authbridge.credentials.DirectoryUser;
import com.authbridge.credentials.Identity;
import com.authbridge.credentials.UpsertResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VerifiedDirectoryClient")
class VerifiedDirectoryClientTest {

    private final DirectoryClient delegate = mock(DirectoryClient.class);
    private final VerifiedDirectoryClient client = new VerifiedDirectoryClient(delegate);
    private final DirectoryUser user =
            DirectoryUser.forIdentity(Identity.of("alice", List.of()), "pw", List.of("kibana_user"));

    @Test
    @DisplayName("checks credentials once before the first write")
    void authenticatesOnce() {
        when(delegate.upsertUser(user)).thenReturn(UpsertResult.created());

        client.upsertUser(user);
        client.upsertUser(user);

        verify(delegate, times(1)).authenticate();
        verify(delegate, times(2)).upsertUser(user);
        assertThat(client.isVerified()).isTrue();
    }

    @Test
    @DisplayName("refused credentials become a rejection and are checked again next time")
    void refusedThenRetried() {
        doThrow(new DirectoryAuthenticationException(401, "bad credentials"))
                .doNothing()
                .when(delegate)
                .authenticate();
        when(delegate.upsertUser(user)).thenReturn(UpsertResult.updated());

        UpsertResult first = client.upsertUser(user);
        UpsertResult second = client.upsertUser(user);

        assertThat(first).isEqualTo(new UpsertResult.Rejected(401, "bad credentials"));
        assertThat(second).isInstanceOf(UpsertResult.Updated.class);
        verify(delegate, times(2)).authenticate();
        verify(delegate, times(1)).upsertUser(user);
    }

    @Test
    @DisplayName("an unreachable directory propagates without writing")
    void unreachable() {
        doThrow(new DirectoryConnectException("refused", null)).when(delegate).authenticate();

        assertThatThrownBy(() -> client.upsertUser(user)).isInstanceOf(DirectoryConnectException.class);
        verify(delegate, never()).upsertUser(user);
        assertThat(client.isVerified()).isFalse();
    }

    @Test
    @DisplayName("explicit authenticate also marks the client verified")
    void explicitAuthenticate() {
        doNothing().when(delegate).authenticate();

        client.authenticate();
        client.authenticate();

        verify(delegate, times(1)).authenticate();
    }
}
