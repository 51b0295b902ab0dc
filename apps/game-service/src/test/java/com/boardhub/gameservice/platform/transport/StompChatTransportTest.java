package com.boardhub.gameservice.platform.transport;

import com.boardhub.gameservice.serializer.event.Attachment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StompChatTransportTest {

    @Mock
    private SimpMessagingTemplate messaging;
    @Mock
    private RestClient.Builder restClientBuilder;
    @Mock
    private RestClient restClient;

    private StompChatTransport transport;

    @BeforeEach
    void setUp() {
        when(restClientBuilder.build()).thenReturn(restClient);
        transport = new StompChatTransport(messaging, restClientBuilder);
    }

    @Test
    void decodesInlineAttachments() throws IOException {
        String encoded = Base64.getEncoder().encodeToString("hello".getBytes(StandardCharsets.UTF_8));

        byte[] fromDataUri = transport.readAttachment(Attachment.remote("a.txt", "text/plain", "data:text/plain;base64," + encoded));
        byte[] fromBase64 = transport.readAttachment(Attachment.remote("a.txt", "text/plain", encoded));

        assertThat(new String(fromDataUri, StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(fromBase64).isEqualTo(fromDataUri);
        verifyNoInteractions(restClient);
    }

    @Test
    void malformedInlineDataIsAnIoFailure() {
        assertThatThrownBy(() -> transport.readAttachment(Attachment.remote("a.png", "image/png", "%%%not-base64%%%")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void emptySourceYieldsZeroBytes() throws IOException {
        assertThat(transport.readAttachment(Attachment.remote("a.png", "image/png", " "))).isEmpty();
    }

    @Test
    void deletionIsBroadcastOnTheChannelTopic() {
        transport.delete("c1", "m9");

        ArgumentCaptor<Envelope<?>> sent = ArgumentCaptor.forClass(Envelope.class);
        verify(messaging).convertAndSend(eq("/topic/channel.c1"), sent.capture());
        assertThat(sent.getValue().kind()).isEqualTo(Envelope.Kind.DELETE);
        assertThat(sent.getValue().payload()).isEqualTo("m9");
    }

    @Test
    void noticesGoToTheUserQueue() {
        transport.notifyUser("c1", "u1", "not your turn");

        verify(messaging).convertAndSendToUser(eq("u1"), eq("/queue/board"), any(Envelope.class));
    }
}
